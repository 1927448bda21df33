package com.dealerscout.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 정규화가 끝난 딜러 위치 레코드(중복 제거 직전 형태).
 * country는 region으로부터만 결정되며, region이 있으면 절대 비지 않는다.
 */
public final class CanonicalRecord {
    private final String name;
    private final String street;
    private final String city;
    private final String region;
    private final String postalCode;
    private final String country;
    private final String phone;
    private final String website;
    private final String websiteDomain;
    private final Set<String> brandTags;
    private final Category category;

    // 출처 메타
    private final String dealerGroup;
    private final String sourceStrategy;
    private final Tier sourceTier;
    private final String sourceUrl;

    private CanonicalRecord(Builder b) {
        this.name = b.name;
        this.street = b.street;
        this.city = b.city;
        this.region = b.region;
        this.postalCode = b.postalCode;
        this.country = b.country;
        this.phone = b.phone;
        this.website = b.website;
        this.websiteDomain = b.websiteDomain;
        this.brandTags = (b.brandTags == null)
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(b.brandTags));
        this.category = (b.category == null) ? Category.UNKNOWN : b.category;
        this.dealerGroup = b.dealerGroup;
        this.sourceStrategy = b.sourceStrategy;
        this.sourceTier = b.sourceTier;
        this.sourceUrl = b.sourceUrl;
    }

    public String getName() { return name; }
    public String getStreet() { return street; }
    public String getCity() { return city; }
    public String getRegion() { return region; }
    public String getPostalCode() { return postalCode; }
    public String getCountry() { return country; }
    public String getPhone() { return phone; }
    public String getWebsite() { return website; }
    public String getWebsiteDomain() { return websiteDomain; }
    /** 이름에 등장한 순서대로 */
    public Set<String> getBrandTags() { return brandTags; }
    public Category getCategory() { return category; }
    public String getDealerGroup() { return dealerGroup; }
    public String getSourceStrategy() { return sourceStrategy; }
    public Tier getSourceTier() { return sourceTier; }
    public String getSourceUrl() { return sourceUrl; }

    /** 값이 채워진 내용 필드 수(출처 메타 제외). 중복 병합 시 승자 판정에 쓴다. */
    public int populatedFieldCount() {
        int n = 0;
        if (present(name)) n++;
        if (present(street)) n++;
        if (present(city)) n++;
        if (present(region)) n++;
        if (present(postalCode)) n++;
        if (present(country)) n++;
        if (present(phone)) n++;
        if (present(website)) n++;
        if (present(websiteDomain)) n++;
        if (!brandTags.isEmpty()) n++;
        if (category != Category.UNKNOWN) n++;
        return n;
    }

    private static boolean present(String s) { return s != null && !s.isBlank(); }

    public Builder toBuilder() {
        return new Builder()
                .name(name).street(street).city(city).region(region)
                .postalCode(postalCode).country(country).phone(phone)
                .website(website).websiteDomain(websiteDomain)
                .brandTags(brandTags).category(category)
                .dealerGroup(dealerGroup).sourceStrategy(sourceStrategy)
                .sourceTier(sourceTier).sourceUrl(sourceUrl);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanonicalRecord r)) return false;
        return Objects.equals(name, r.name)
                && Objects.equals(street, r.street)
                && Objects.equals(city, r.city)
                && Objects.equals(region, r.region)
                && Objects.equals(postalCode, r.postalCode)
                && Objects.equals(country, r.country)
                && Objects.equals(phone, r.phone)
                && Objects.equals(website, r.website)
                && Objects.equals(websiteDomain, r.websiteDomain)
                && Objects.equals(brandTags, r.brandTags)
                && category == r.category
                && Objects.equals(dealerGroup, r.dealerGroup)
                && Objects.equals(sourceStrategy, r.sourceStrategy)
                && sourceTier == r.sourceTier
                && Objects.equals(sourceUrl, r.sourceUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, street, city, region, postalCode, country, phone,
                website, websiteDomain, brandTags, category, dealerGroup,
                sourceStrategy, sourceTier, sourceUrl);
    }

    @Override
    public String toString() {
        return "CanonicalRecord{" + name + " | " + street + ", " + city + ", " + region
                + " " + (postalCode == null ? "" : postalCode) + " | " + country
                + " | " + category + " " + brandTags + "}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String name;
        private String street;
        private String city;
        private String region;
        private String postalCode;
        private String country;
        private String phone;
        private String website;
        private String websiteDomain;
        private Set<String> brandTags;
        private Category category;
        private String dealerGroup;
        private String sourceStrategy;
        private Tier sourceTier;
        private String sourceUrl;

        public Builder name(String v) { this.name = v; return this; }
        public Builder street(String v) { this.street = v; return this; }
        public Builder city(String v) { this.city = v; return this; }
        public Builder region(String v) { this.region = v; return this; }
        public Builder postalCode(String v) { this.postalCode = v; return this; }
        public Builder country(String v) { this.country = v; return this; }
        public Builder phone(String v) { this.phone = v; return this; }
        public Builder website(String v) { this.website = v; return this; }
        public Builder websiteDomain(String v) { this.websiteDomain = v; return this; }
        public Builder brandTags(Set<String> v) { this.brandTags = v; return this; }
        public Builder category(Category v) { this.category = v; return this; }
        public Builder dealerGroup(String v) { this.dealerGroup = v; return this; }
        public Builder sourceStrategy(String v) { this.sourceStrategy = v; return this; }
        public Builder sourceTier(Tier v) { this.sourceTier = v; return this; }
        public Builder sourceUrl(String v) { this.sourceUrl = v; return this; }

        public String name() { return name; }

        public CanonicalRecord build() {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
            return new CanonicalRecord(this);
        }
    }
}
