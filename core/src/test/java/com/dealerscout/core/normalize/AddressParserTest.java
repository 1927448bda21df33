package com.dealerscout.core.normalize;

import com.dealerscout.core.model.ParsedAddress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AddressParserTest {

    private final AddressParser parser = new AddressParser();

    @Test
    void comma_delimited_us_address() {
        ParsedAddress p = parser.parse("123 Main Street, Austin, TX 78701");

        assertThat(p).isEqualTo(new ParsedAddress("123 Main St", "Austin", "TX", "78701"));
        assertThat(p.hasWarnings()).isFalse();
    }

    @Test
    void full_region_name_is_mapped_to_code() {
        ParsedAddress p = parser.parse("500 Oak Avenue, Portland, Oregon 97201");

        assertThat(p.street()).isEqualTo("500 Oak Ave");
        assertThat(p.region()).isEqualTo("OR");
        assertThat(p.postalCode()).isEqualTo("97201");
    }

    @Test
    void trailing_country_is_ignored() {
        ParsedAddress p = parser.parse("77 Elm St, Columbus, OH 43215, USA");
        assertThat(p).isEqualTo(new ParsedAddress("77 Elm St", "Columbus", "OH", "43215"));
    }

    @Test
    @DisplayName("줄바꿈 블록 + 캐나다 우편번호")
    void multi_line_canadian_block() {
        ParsedAddress p = parser.parse("1200 Queen Street East\nToronto, Ontario M4M 1K7\nCanada");

        assertThat(p.street()).isEqualTo("1200 Queen St East");
        assertThat(p.city()).isEqualTo("Toronto");
        assertThat(p.region()).isEqualTo("ON");
        assertThat(p.postalCode()).isEqualTo("M4M 1K7");
        assertThat(p.warnings()).isEmpty();
    }

    @Test
    void multi_line_skips_phone_lines() {
        ParsedAddress p = parser.parse("9 Oak Ave\nEugene, OR 97401\n(541) 555-0200");
        assertThat(p).isEqualTo(new ParsedAddress("9 Oak Ave", "Eugene", "OR", "97401"));
    }

    @Test
    void inline_tail_without_commas() {
        ParsedAddress p = parser.parse("4500 W Broad St Richmond VA 23230");
        assertThat(p).isEqualTo(new ParsedAddress("4500 W Broad St", "Richmond", "VA", "23230"));
    }

    @Test
    @DisplayName("Suite가 붙은 번지도 street에 남는다")
    void suite_stays_in_street() {
        ParsedAddress p = parser.parse("456 Oak Ave Suite 2, Austin, TX 78701");
        assertThat(p).isEqualTo(new ParsedAddress("456 Oak Ave Suite 2", "Austin", "TX", "78701"));
    }

    @Test
    @DisplayName("도시 이름이 지역명이어도 뒤의 코드가 region이다")
    void city_named_like_a_region() {
        assertThat(parser.parse("100 Main St New York, NY 10001"))
                .isEqualTo(new ParsedAddress("100 Main St", "New York", "NY", "10001"));
        assertThat(parser.parse("350 5th Ave New York NY 10118"))
                .isEqualTo(new ParsedAddress("350 5th Ave", "New York", "NY", "10118"));
        assertThat(parser.parse("1600 Pennsylvania Ave Washington, DC 20500"))
                .isEqualTo(new ParsedAddress("1600 Pennsylvania Ave", "Washington", "DC", "20500"));
    }

    @Test
    void multi_word_region_name_inline() {
        assertThat(parser.parse("100 Main St Kansas City, MO 64101"))
                .isEqualTo(new ParsedAddress("100 Main St", "Kansas City", "MO", "64101"));
        assertThat(parser.parse("900 Lee St Charleston West Virginia 25301"))
                .isEqualTo(new ParsedAddress("900 Lee St", "Charleston", "WV", "25301"));
    }

    @Test
    void lower_case_code_in_its_own_segment() {
        assertThat(parser.parse("123 Main St, Springfield, or 97477"))
                .isEqualTo(new ParsedAddress("123 Main St", "Springfield", "OR", "97477"));
        assertThat(parser.parse("9 Bay St, Toronto, on, M5J 2R8"))
                .isEqualTo(new ParsedAddress("9 Bay St", "Toronto", "ON", "M5J 2R8"));
    }

    @Test
    void canadian_postal_code_for_us_region_is_kept_with_warning() {
        ParsedAddress p = parser.parse("100 King St, Buffalo, NY M5V 2T6");

        assertThat(p.postalCode()).isEqualTo("M5V 2T6");
        assertThat(p.warnings()).singleElement().asString().contains("Canadian postal code");
    }

    @Test
    void nine_digit_zip_is_hyphenated() {
        ParsedAddress p = parser.parse("1 Plaza Dr, Dallas, TX 752011234");
        assertThat(p.postalCode()).isEqualTo("75201-1234");
    }

    @Test
    void unknown_region_is_not_parsed() {
        assertThat(parser.parse("123 Main St, Springfield, ZZ 12345")).isNull();
    }

    @Test
    void blank_input_is_null() {
        assertThat(parser.parse(null)).isNull();
        assertThat(parser.parse("   ")).isNull();
        assertThat(parser.parse("Address: ")).isNull();
    }

    @Test
    void formatted_address_parses_back_to_same_fields() {
        ParsedAddress first = parser.parse("8800 Research Boulevard, Suite 100, Austin, TX 78758");
        String line = AddressParser.format(first.street(), first.city(), first.region(), first.postalCode());

        assertThat(line).isEqualTo("8800 Research Blvd, Suite 100, Austin, TX 78758");
        assertThat(parser.parse(line)).isEqualTo(first);
    }
}
