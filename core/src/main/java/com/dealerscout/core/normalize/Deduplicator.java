package com.dealerscout.core.normalize;

import com.dealerscout.core.model.CanonicalRecord;
import com.dealerscout.core.model.Category;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 같은 DedupeKey의 레코드를 하나로 병합한다.
 *  - 승자: 채워진 필드가 많은 쪽 → 동률이면 상위 tier → 동률이면 먼저 나온 쪽
 *  - 병합: 승자의 빈 필드만 패자로 채운다(있는 값을 덮어쓰지 않음)
 *  - 출력 순서: 각 키가 처음 나온 위치(안정적, 재정렬 없음)
 * dedupe(dedupe(x)) == dedupe(x)
 */
public class Deduplicator {

    public List<CanonicalRecord> dedupe(List<CanonicalRecord> records) {
        if (records == null || records.isEmpty()) return List.of();

        List<CanonicalRecord> out = new ArrayList<>(records.size());
        Map<DedupeKey, Integer> slot = new HashMap<>();

        for (CanonicalRecord r : records) {
            if (r == null) continue;
            DedupeKey key = DedupeKey.of(r);
            if (!key.isComplete()) {
                out.add(r);
                continue;
            }
            Integer idx = slot.get(key);
            if (idx == null) {
                slot.put(key, out.size());
                out.add(r);
            } else {
                out.set(idx, merge(out.get(idx), r));
            }
        }
        return List.copyOf(out);
    }

    /** existing이 먼저 나온 레코드 */
    static CanonicalRecord merge(CanonicalRecord existing, CanonicalRecord incoming) {
        CanonicalRecord winner = existing;
        CanonicalRecord loser = incoming;
        int a = existing.populatedFieldCount();
        int b = incoming.populatedFieldCount();
        if (b > a || (b == a && incoming.getSourceTier() != null
                && incoming.getSourceTier().outranks(existing.getSourceTier()))) {
            winner = incoming;
            loser = existing;
        }
        return fillGaps(winner, loser);
    }

    private static CanonicalRecord fillGaps(CanonicalRecord w, CanonicalRecord l) {
        CanonicalRecord.Builder b = w.toBuilder();
        if (blank(w.getCity())) b.city(l.getCity());
        if (blank(w.getRegion()) && !blank(l.getRegion())) {
            // region과 country는 한 쌍으로 움직인다
            b.region(l.getRegion()).country(l.getCountry());
        }
        if (blank(w.getPostalCode())) b.postalCode(l.getPostalCode());
        if (blank(w.getPhone())) b.phone(l.getPhone());
        if (blank(w.getWebsite())) b.website(l.getWebsite());
        if (blank(w.getWebsiteDomain())) b.websiteDomain(l.getWebsiteDomain());
        if (w.getBrandTags().isEmpty()) b.brandTags(l.getBrandTags());
        if (w.getCategory() == Category.UNKNOWN) b.category(l.getCategory());
        if (blank(w.getDealerGroup())) b.dealerGroup(l.getDealerGroup());
        return b.build();
    }

    private static boolean blank(String s) { return s == null || s.isBlank(); }
}
