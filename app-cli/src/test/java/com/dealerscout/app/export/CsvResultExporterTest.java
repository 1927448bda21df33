package com.dealerscout.app.export;

import com.dealerscout.core.model.CanonicalRecord;
import com.dealerscout.core.model.Category;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvResultExporterTest {

    private final CsvResultExporter exporter = new CsvResultExporter();

    @Test
    void header_then_one_quoted_row_per_record() throws Exception {
        CanonicalRecord r = CanonicalRecord.builder()
                .name("Smith, Jones \"SJ\" Motors")
                .street("123 Main St")
                .city("Springfield").region("OR").postalCode("97477")
                .country("United States of America")
                .phone("(541) 555-0100")
                .website("https://sjmotors.example.com")
                .brandTags(new LinkedHashSet<>(List.of("Ford", "Lincoln")))
                .category(Category.FRANCHISED)
                .build();
        ExtractionReport report = new ExtractionReport("Example Group", Instant.EPOCH, List.of(), List.of(r));

        StringWriter w = new StringWriter();
        exporter.write(report, w);

        String[] lines = w.toString().split("\r\n");
        assertThat(lines).hasSize(2);
        assertThat(lines[0]).isEqualTo("Dealership,Dealer Group,Dealership Type,Car Brand,Address,City,"
                + "State/Province,Postal Code,Phone,Country,Website");
        assertThat(lines[1]).isEqualTo("\"Smith, Jones \"\"SJ\"\" Motors\",Example Group,Franchised,Ford; Lincoln,"
                + "123 Main St,Springfield,OR,97477,(541) 555-0100,United States of America,https://sjmotors.example.com");
    }

    @Test
    void empty_report_still_has_header() throws Exception {
        StringWriter w = new StringWriter();
        exporter.write(new ExtractionReport("G", null, null, null), w);

        assertThat(w.toString()).startsWith("Dealership,").endsWith("\r\n");
        assertThat(w.toString().split("\r\n")).hasSize(1);
    }

    @Test
    void type_labels_and_quoting() {
        assertThat(CsvResultExporter.typeLabel(Category.FIXED_OPS)).isEqualTo("Fixed Ops");
        assertThat(CsvResultExporter.typeLabel(null)).isEqualTo("Unknown");
        assertThat(CsvResultExporter.quote("plain")).isEqualTo("plain");
        assertThat(CsvResultExporter.quote("two\nlines")).isEqualTo("\"two\nlines\"");
        assertThat(CsvResultExporter.quote(null)).isEmpty();
    }
}
