package com.judgmentbell.common.codec;

import com.judgmentbell.common.model.CrossType;
import com.judgmentbell.common.model.Language;
import com.judgmentbell.common.model.MeasurementSetting;
import com.judgmentbell.common.model.Party;
import com.judgmentbell.common.model.PartyFrame;
import com.judgmentbell.common.model.Tense;
import com.judgmentbell.common.model.TrialCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Encoding layout, round trip, and one decode case per historically observed layout.
 */
class TrialIdentifierCodecTest {

    private final TrialIdentifierCodec codec = new TrialIdentifierCodec();

    private static TrialCondition condition(MeasurementSetting setting, Party subject, int trial, String salt) {
        return new TrialCondition("trolley_standoff",
            new PartyFrame(Language.ENGLISH, Tense.PAST),
            new PartyFrame(Language.JAPANESE, Tense.FUTURE),
            setting, subject, trial, CrossType.CROSS_DIMENSIONAL, salt);
    }

    // ── encode ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("encode()")
    class EncodeTests {

        @Test
        @DisplayName("fixed token layout with padded trial and fused pair+subject code")
        void layout() {
            String id = codec.encode(condition(MeasurementSetting.PS, Party.ALPHA, 7, "9f3c21ab"));
            assertEquals("xdim_trolle_en-pas_ja-fut_007_psa_9f3c21ab", id);
        }

        @Test
        @DisplayName("scenario tag keeps letters only, at most six")
        void scenarioTag() {
            assertEquals("tainte", TrialIdentifierCodec.scenarioTag("tainted_inheritance"));
            assertEquals("kidney", TrialIdentifierCodec.scenarioTag("Kidney-Gift"));
            assertEquals("scn", TrialIdentifierCodec.scenarioTag("42"));
        }

        @Test
        @DisplayName("random salts are eight hex characters and vary")
        void randomSalt() {
            Set<String> salts = new HashSet<>();
            for (int i = 0; i < 50; i++) {
                String salt = TrialIdentifierCodec.randomSalt().get();
                assertTrue(salt.matches("[0-9a-f]{8}"), salt);
                salts.add(salt);
            }
            assertTrue(salts.size() > 1);
        }
    }

    // ── round trip ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("decode(encode(c))")
    class RoundTripTests {

        @Test
        @DisplayName("recovers trial index, axis pair and subject for every setting and party")
        void roundTrip() {
            int trial = 0;
            for (MeasurementSetting setting : MeasurementSetting.values()) {
                for (Party party : Party.values()) {
                    TrialCondition c = condition(setting, party, trial * 37, "a1b2c3d4");
                    DecodedIdentifier decoded = codec.decode(codec.encode(c)).orElseThrow();
                    assertEquals(c.trialIndex(), decoded.trialIndex());
                    assertEquals(setting, decoded.setting());
                    assertEquals(party, decoded.subject());
                    trial++;
                }
            }
        }

        @Test
        @DisplayName("purely numeric salt does not displace the trial index")
        void numericSalt() {
            DecodedIdentifier decoded = codec.decode(
                codec.encode(condition(MeasurementSetting.SS, Party.BETA, 4, "12345678"))).orElseThrow();
            assertEquals(4, decoded.trialIndex());
            assertEquals(MeasurementSetting.SS, decoded.setting());
            assertEquals("numeric-anchor", decoded.strategy());
        }
    }

    // ── historical layouts ────────────────────────────────────────────────

    @Nested
    @DisplayName("decode(): older layouts")
    class LayoutTests {

        @Test
        @DisplayName("m_scenario_lang_TRIAL_AXES_PersonX_salt → numeric anchor")
        void monolingualBatchLayout() {
            DecodedIdentifier d = codec.decode("m_kidney_gift_en_3_pp_PersonA_1a2b3c4d").orElseThrow();
            assertEquals(3, d.trialIndex());
            assertEquals(MeasurementSetting.PP, d.setting());
            assertEquals(Party.ALPHA, d.subject());
            assertEquals("numeric-anchor", d.strategy());
        }

        @Test
        @DisplayName("scenario_TRIAL_AXES_SUBJECT → numeric anchor with beta subject")
        void shortLayout() {
            DecodedIdentifier d = codec.decode("trolley_12_sp_beta").orElseThrow();
            assertEquals(12, d.trialIndex());
            assertEquals(MeasurementSetting.SP, d.setting());
            assertEquals(Party.BETA, d.subject());
        }

        @Test
        @DisplayName("axis pair without a numeric token before it → axis anchor, trial 0")
        void axisAnchorWithoutTrial() {
            DecodedIdentifier d = codec.decode("x_kidney_gift_enja_ss_b_deadbeef").orElseThrow();
            assertEquals(0, d.trialIndex());
            assertEquals(MeasurementSetting.SS, d.setting());
            assertEquals(Party.BETA, d.subject());
            assertEquals("axis-anchor", d.strategy());
        }

        @Test
        @DisplayName("numeric token not followed by a pair → axis anchor searches backward")
        void axisAnchorBackwardSearch() {
            DecodedIdentifier d = codec.decode("run_5_x_ps_a").orElseThrow();
            assertEquals(5, d.trialIndex());
            assertEquals(MeasurementSetting.PS, d.setting());
            assertEquals(Party.ALPHA, d.subject());
        }

        @Test
        @DisplayName("bare pair code followed by salt → subject absent")
        void bareSubjectless() {
            DecodedIdentifier d = codec.decode("xlang_kidney_en-pre_ja-pre_001_pp_deadbeef").orElseThrow();
            assertEquals(1, d.trialIndex());
            assertNull(d.subject());
            assertEquals(Optional.empty(), d.subjectIfPresent());
        }

        @Test
        @DisplayName("cross layout with per-party axis codes (pa/sb) → no match")
        void perPartyAxisCodes() {
            assertTrue(codec.decode("x_kidney_gift_enja_3_pa_PersonA_1a2b3c4d").isEmpty());
        }

        @Test
        @DisplayName("unrelated, blank and null identifiers → no match, never an exception")
        void noMatch() {
            assertTrue(codec.decode("garbage_identifier").isEmpty());
            assertTrue(codec.decode("").isEmpty());
            assertTrue(codec.decode(null).isEmpty());
        }

        @Test
        @DisplayName("trial token too large for an int (timestamp) → no match, never an exception")
        void overflowingTrialToken() {
            assertTrue(codec.decode("m_trolle_en_1734567890123_pp_a_ff").isEmpty());
            assertTrue(codec.decode("m_s_en_99999999999_pp_a_x").isEmpty());
            assertTrue(codec.decode("m_s_en_2147483648_ss_b").isEmpty());
        }

        @Test
        @DisplayName("largest int trial token → still decoded")
        void largestTrialToken() {
            assertEquals(Integer.MAX_VALUE,
                codec.decode("m_s_en_2147483647_ss_b").orElseThrow().trialIndex());
        }
    }
}
