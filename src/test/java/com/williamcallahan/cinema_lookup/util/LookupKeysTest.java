package com.williamcallahan.cinema_lookup.util;

import com.williamcallahan.cinema_lookup.model.MediaType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LookupKeysTest {

    @Test
    void buildsKeyFromTitleYearIdAndType() {
        assertThat(LookupKeys.of("Apocalypse Now", 1979, null, MediaType.FILM))
            .isEqualTo("vpro-apocalypse-now-1979-none-m");
        assertThat(LookupKeys.of("Downfall", 2004, "tt0363163", MediaType.FILM))
            .isEqualTo("vpro-downfall-2004-tt0363163-m");
        assertThat(LookupKeys.of("Tokyo Vice", null, null, MediaType.SERIES))
            .isEqualTo("vpro-tokyo-vice-0-none-s");
    }

    @Test
    void sameInputAlwaysYieldsSameKey() {
        assertThat(LookupKeys.of("Amélie", 2001, null, null))
            .isEqualTo(LookupKeys.of("AMELIE", 2001, null, MediaType.FILM));
    }

    @Test
    void nonLatinTitlesWithSameYearGetDifferentKeys() {
        String sevenSamurai = LookupKeys.of("七人の侍", 1954, null, MediaType.FILM);
        String godzilla = LookupKeys.of("ゴジラ", 1954, null, MediaType.FILM);

        assertThat(sevenSamurai).isNotEqualTo(godzilla);
        assertThat(sevenSamurai).matches("vpro-unknown-[0-9a-f]{8}-1954-none-m");
        assertThat(LookupKeys.isValid(sevenSamurai)).isTrue();
        assertThat(LookupKeys.isValid(godzilla)).isTrue();
    }

    @Test
    void generatedKeysAreValid() {
        assertThat(LookupKeys.isValid(LookupKeys.of("Léon: The Professional", 1994, "tt0110413", MediaType.FILM))).isTrue();
    }

    @Test
    void rejectsUnsafeKeys() {
        assertThat(LookupKeys.isValid(null)).isFalse();
        assertThat(LookupKeys.isValid("")).isFalse();
        assertThat(LookupKeys.isValid("vpro-../../etc/passwd")).isFalse();
        assertThat(LookupKeys.isValid("vpro-Upper-Case")).isFalse();
        assertThat(LookupKeys.isValid("other-prefix-1979-none-m")).isFalse();
        assertThat(LookupKeys.isValid("vpro-" + "a".repeat(200))).isFalse();
    }
}
