package com.sonicbridge.normalization;

import com.sonicbridge.domain.EventAction;
import com.sonicbridge.domain.EventCategory;
import com.sonicbridge.domain.Protocol;
import com.sonicbridge.domain.Severity;
import com.sonicbridge.domain.ThreatSeverity;
import com.sonicbridge.domain.ThreatType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FieldNormalizer Tests")
class FieldNormalizerTest {

    // ========== Severity ==========

    @ParameterizedTest
    @CsvSource({
        "0, CRITICAL", "1, CRITICAL", "2, CRITICAL",
        "3, HIGH", "4, HIGH",
        "5, MEDIUM", "6, MEDIUM",
        "7, LOW",
        "8, INFO", "-1, INFO"
    })
    void testSeverityFromPriority_ShouldFollowSyslogBands(int priority, Severity expected) {
        assertThat(FieldNormalizer.severityFromPriority(priority)).isEqualTo(expected);
    }

    @Test
    void testSeverityFromText_WithKeywordsAndNumbers() {
        assertThat(FieldNormalizer.severityFromText("Critical")).isEqualTo(Severity.CRITICAL);
        assertThat(FieldNormalizer.severityFromText("warning")).isEqualTo(Severity.MEDIUM);
        assertThat(FieldNormalizer.severityFromText("notice")).isEqualTo(Severity.LOW);
        assertThat(FieldNormalizer.severityFromText("3")).isEqualTo(Severity.HIGH);
        assertThat(FieldNormalizer.severityFromText("whatever")).isEqualTo(Severity.INFO);
        assertThat(FieldNormalizer.severityFromText(null)).isEqualTo(Severity.INFO);
    }

    @Test
    void testThreatSeverity_ShouldCollapseInfoToLow() {
        assertThat(FieldNormalizer.threatSeverity("critical")).isEqualTo(ThreatSeverity.CRITICAL);
        assertThat(FieldNormalizer.threatSeverity("high")).isEqualTo(ThreatSeverity.HIGH);
        assertThat(FieldNormalizer.threatSeverity("info")).isEqualTo(ThreatSeverity.LOW);
    }

    // ========== Category ==========

    @Test
    void testCategoryFromCode_ShouldMapKnownCodes() {
        assertThat(FieldNormalizer.categoryFromCode(1)).isEqualTo(EventCategory.FIREWALL);
        assertThat(FieldNormalizer.categoryFromCode(2)).isEqualTo(EventCategory.VPN);
        assertThat(FieldNormalizer.categoryFromCode(3)).isEqualTo(EventCategory.IPS);
        assertThat(FieldNormalizer.categoryFromCode(4)).isEqualTo(EventCategory.ANTIVIRUS);
        assertThat(FieldNormalizer.categoryFromCode(99)).isEqualTo(EventCategory.SYSTEM);
    }

    // ========== Action ==========

    @ParameterizedTest
    @CsvSource({
        "'Connection allowed', ALLOW",
        "'Traffic permitted by rule 5', ALLOW",
        "'Packet blocked', DENY",
        "'Access denied', DENY",
        "'Packet dropped', DROP",
        "'TCP reset sent', RESET",
        "'Suspicious traffic pattern', DENY",
        "'', DENY"
    })
    void testActionFromText_ShouldMatchWholeWords(String message, EventAction expected) {
        assertThat(FieldNormalizer.actionFromText(message)).isEqualTo(expected);
    }

    @Test
    void testActionFromText_WhenWordIsOnlyASubstring_ShouldNotMatch() {
        // "disallowance" contains "allow" but not as a word
        assertThat(FieldNormalizer.actionFromText("disallowance noted")).isEqualTo(EventAction.DENY);
    }

    // ========== Protocol / ports / addresses ==========

    @Test
    void testProtocol_ShouldAcceptNamesNumbersAndServiceSuffix() {
        assertThat(FieldNormalizer.protocol("tcp")).isEqualTo(Protocol.TCP);
        assertThat(FieldNormalizer.protocol("17")).isEqualTo(Protocol.UDP);
        assertThat(FieldNormalizer.protocol("icmp")).isEqualTo(Protocol.ICMP);
        assertThat(FieldNormalizer.protocol("tcp/https")).isEqualTo(Protocol.TCP);
        assertThat(FieldNormalizer.protocol("gre")).isEqualTo(Protocol.OTHER);
        assertThat(FieldNormalizer.protocol(null)).isEqualTo(Protocol.OTHER);
    }

    @Test
    void testPort_ShouldRejectOutOfRangeAndGarbage() {
        assertThat(FieldNormalizer.port("443")).contains(443);
        assertThat(FieldNormalizer.port(22)).contains(22);
        assertThat(FieldNormalizer.port("70000")).isEmpty();
        assertThat(FieldNormalizer.port("https")).isEmpty();
        assertThat(FieldNormalizer.port(null)).isEmpty();
    }

    @Test
    void testPort_WhenBigNumberWouldWrap_ShouldBeAbsent() {
        // 2^64 + 80 narrows to 80 with longValue()
        BigInteger wrapsToHttp = BigInteger.ONE.shiftLeft(64).add(BigInteger.valueOf(80));

        assertThat(FieldNormalizer.port(wrapsToHttp)).isEmpty();
        assertThat(FieldNormalizer.port(new BigDecimal(wrapsToHttp))).isEmpty();
        assertThat(FieldNormalizer.port(BigInteger.valueOf(8080))).contains(8080);
        assertThat(FieldNormalizer.port(443.0)).contains(443);
        assertThat(FieldNormalizer.port(-1L)).isEmpty();
    }

    @Test
    void testIpv4Addresses_ShouldSkipInvalidOctets() {
        assertThat(FieldNormalizer.ipv4Addresses("from 10.0.0.1 via 999.1.1.1 to 192.168.1.20"))
            .containsExactly("10.0.0.1", "192.168.1.20");
    }

    @Test
    void testThreatType_ShouldRecognizeCommonNames() {
        assertThat(FieldNormalizer.threatType("malware")).isEqualTo(ThreatType.MALWARE);
        assertThat(FieldNormalizer.threatType("intrusion")).isEqualTo(ThreatType.INTRUSION);
        assertThat(FieldNormalizer.threatType("botnet")).isEqualTo(ThreatType.BOTNET);
        assertThat(FieldNormalizer.threatType("unheard-of")).isEqualTo(ThreatType.SUSPICIOUS);
    }
}
