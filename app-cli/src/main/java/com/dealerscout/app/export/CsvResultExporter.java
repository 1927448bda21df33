package com.dealerscout.app.export;

import com.dealerscout.core.model.CanonicalRecord;
import com.dealerscout.core.model.Category;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * 스프레드시트용 CSV(RFC 4180 인용 규칙, CRLF 줄바꿈).
 * 레코드가 없어도 헤더 한 줄은 쓴다.
 */
public class CsvResultExporter implements ResultExporter {

    public static final List<String> COLUMNS = List.of(
            "Dealership", "Dealer Group", "Dealership Type", "Car Brand",
            "Address", "City", "State/Province", "Postal Code",
            "Phone", "Country", "Website");

    private static final String EOL = "\r\n";

    @Override
    public String extension() { return "csv"; }

    @Override
    public void write(ExtractionReport report, Writer out) throws IOException {
        writeRow(out, COLUMNS);
        for (CanonicalRecord r : report.getRecords()) {
            String group = (r.getDealerGroup() != null) ? r.getDealerGroup() : report.getDealerGroup();
            writeRow(out, List.of(
                    nz(r.getName()),
                    nz(group),
                    typeLabel(r.getCategory()),
                    String.join("; ", r.getBrandTags()),
                    nz(r.getStreet()),
                    nz(r.getCity()),
                    nz(r.getRegion()),
                    nz(r.getPostalCode()),
                    nz(r.getPhone()),
                    nz(r.getCountry()),
                    nz(r.getWebsite())));
        }
        out.flush();
    }

    /** 사람이 읽는 분류명 */
    public static String typeLabel(Category c) {
        if (c == null) return "Unknown";
        switch (c) {
            case FRANCHISED: return "Franchised";
            case USED:       return "Used";
            case COLLISION:  return "Collision";
            case FIXED_OPS:  return "Fixed Ops";
            default:         return "Unknown";
        }
    }

    private static void writeRow(Writer out, List<String> cells) throws IOException {
        StringBuilder sb = new StringBuilder(128);
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(quote(cells.get(i)));
        }
        sb.append(EOL);
        out.write(sb.toString());
    }

    static String quote(String v) {
        if (v == null) return "";
        boolean needs = v.indexOf(',') >= 0 || v.indexOf('"') >= 0
                || v.indexOf('\n') >= 0 || v.indexOf('\r') >= 0;
        if (!needs) return v;
        return '"' + v.replace("\"", "\"\"") + '"';
    }

    private static String nz(String s) { return (s == null) ? "" : s; }
}
