package tech.clusterops.sdk.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlEncodingTest {

    @Test
    @DisplayName("path segments encode spaces as %20 and slashes as %2F")
    void pathSegmentEncodesReservedCharacters() {
        assertThat(UrlEncoding.pathSegment("jane doe")).isEqualTo("jane%20doe");
        assertThat(UrlEncoding.pathSegment("a/b")).isEqualTo("a%2Fb");
        assertThat(UrlEncoding.pathSegment("web_logs-2")).isEqualTo("web_logs-2");
    }

    @Test
    @DisplayName("form values use plus for spaces")
    void formValueUsesPlusForSpaces() {
        assertThat(UrlEncoding.formValue("New User")).isEqualTo("New+User");
        assertThat(UrlEncoding.formValue("a&b=c")).isEqualTo("a%26b%3Dc");
    }
}
