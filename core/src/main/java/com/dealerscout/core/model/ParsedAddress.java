package com.dealerscout.core.model;

import java.util.List;

/**
 * 주소 분해 결과. postalCode는 없을 수 있다.
 * warnings: 형식이 어긋난 우편번호 등 파싱은 통과했지만 알려둘 것들.
 */
public record ParsedAddress(String street,
                            String city,
                            String region,
                            String postalCode,
                            List<String> warnings) {

    public ParsedAddress {
        warnings = (warnings == null) ? List.of() : List.copyOf(warnings);
    }

    public ParsedAddress(String street, String city, String region, String postalCode) {
        this(street, city, region, postalCode, List.of());
    }

    public boolean hasWarnings() { return !warnings.isEmpty(); }
}
