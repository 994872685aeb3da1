package com.judgmentbell.common.format;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentbell.common.codec.TrialIdentifierCodec;
import com.judgmentbell.common.design.DesignGenerator;
import com.judgmentbell.common.design.DesignParameters;
import com.judgmentbell.common.design.DimensionPair;
import com.judgmentbell.common.design.JsonScenarioCatalog;
import com.judgmentbell.common.design.TrialDesign;
import com.judgmentbell.common.model.ConfigurationKey;
import com.judgmentbell.common.model.CrossType;
import com.judgmentbell.common.model.Language;
import com.judgmentbell.common.model.MeasurementSetting;
import com.judgmentbell.common.model.Party;
import com.judgmentbell.common.model.Tense;
import com.judgmentbell.common.model.TrialCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ManifestCodecTest {

    private final ObjectMapper objectMapper = JsonSupport.newObjectMapper();
    private final TrialIdentifierCodec identifierCodec = new TrialIdentifierCodec();
    private final ManifestCodec codec = new ManifestCodec(objectMapper, identifierCodec);

    @Test
    @DisplayName("written manifest reloads to the same conditions and configuration groupings")
    void reload() throws Exception {
        TrialDesign design;
        try (InputStream in = getClass().getResourceAsStream("/catalog/test-scenarios.json")) {
            design = new DesignGenerator(JsonScenarioCatalog.load(in, objectMapper), identifierCodec)
                .generate(new DesignParameters(2, List.of("trolley_standoff"), null, null, true,
                    List.of(DimensionPair.languages("en-ja")), null,
                    List.of(DimensionPair.frames("en:past-ja:future")), null, null));
        }
        DesignManifest original = DesignManifest.of(design, Instant.parse("2026-01-01T00:00:00Z"));

        DesignManifest reloaded = codec.read(codec.write(original));

        assertEquals(original.auditHash(), reloaded.auditHash());
        assertEquals(original.generatedAt(), reloaded.generatedAt());
        assertEquals(original.parameters(), reloaded.parameters());
        assertEquals(original.conditions(), reloaded.conditions());
        Set<ConfigurationKey> keys = reloaded.conditions().values().stream()
            .map(TrialCondition::configurationKey).collect(Collectors.toSet());
        assertEquals(3, keys.size());
    }

    @Test
    @DisplayName("list-form conditions keyed by their identifier field")
    void listForm() throws Exception {
        String json = "{\"auditHash\": \"abc\", \"conditions\": [{"
            + "\"identifier\": \"mono_kidney_en-pas_en-pas_004_ssb_0badf00d\","
            + "\"scenario\": \"kidney_gift\", \"alpha\": {\"language\": \"en\", \"tense\": \"past\"},"
            + "\"beta\": {\"language\": \"en\", \"tense\": \"past\"}, \"setting\": \"ss\", \"subject\": \"beta\","
            + "\"trial\": 4, \"crossType\": \"mono\", \"salt\": \"0badf00d\"}]}";

        DesignManifest manifest = codec.read(json);

        TrialCondition c = manifest.conditions().get("mono_kidney_en-pas_en-pas_004_ssb_0badf00d");
        assertNotNull(c);
        assertEquals(Party.BETA, c.subject());
        assertEquals(Tense.PAST, c.alpha().tense());
        assertEquals("abc", manifest.auditHash());
    }

    @Test
    @DisplayName("one condition in an unknown language → that entry skipped, the rest kept")
    void unreadableEntrySkipped() throws Exception {
        String good = "{\"scenario\": \"kidney_gift\", \"alpha\": {\"language\": \"en\", \"tense\": \"past\"},"
            + "\"beta\": {\"language\": \"en\", \"tense\": \"past\"}, \"setting\": \"ss\", \"subject\": \"beta\","
            + "\"trial\": 4, \"crossType\": \"mono\", \"salt\": \"0badf00d\"}";
        String bad = "{\"scenario\": \"kidney_gift\", \"alpha\": {\"language\": \"pt\", \"tense\": \"past\"},"
            + "\"beta\": {\"language\": \"en\", \"tense\": \"past\"}, \"setting\": \"ss\", \"subject\": \"alpha\","
            + "\"trial\": 4, \"crossType\": \"mono\", \"salt\": \"0badf00e\"}";
        String json = "{\"auditHash\": \"abc\", \"generatedAt\": \"2026-01-01T00:00:00Z\", \"conditions\": {"
            + "\"good_004_ssb\": " + good + ", \"bad_004_ssa\": " + bad + "}}";

        DesignManifest manifest = codec.read(json);

        assertEquals(Set.of("good_004_ssb"), manifest.conditions().keySet());
        assertEquals("abc", manifest.auditHash());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), manifest.generatedAt());
        assertNull(manifest.parameters());

        String listJson = "{\"conditions\": [" + good.replace("{\"scenario\"", "{\"identifier\": \"good\", \"scenario\"")
            + ", " + bad.replace("{\"scenario\"", "{\"identifier\": \"bad\", \"scenario\"") + "]}";

        assertEquals(Set.of("good"), codec.read(listJson).conditions().keySet());
    }

    @Test
    @DisplayName("flat spec fields: explicit cross_type wins over inference from the two frames")
    void legacyCrossTypeTag() throws Exception {
        String json = "{\"specs\": [{\"custom_id\": \"t_trolley_2_ps_b_00c0ffee\", \"scenario\": \"trolley_standoff\","
            + " \"lang_a\": \"en\", \"lang_b\": \"en\", \"tense_a\": \"past\", \"tense_b\": \"future\","
            + " \"cross_type\": \"xdim\", \"subject\": \"B\"},"
            + "{\"custom_id\": \"t_trolley_2_ps_a_00c0ffef\", \"scenario\": \"trolley_standoff\","
            + " \"lang_a\": \"en\", \"lang_b\": \"en\", \"tense_a\": \"past\", \"tense_b\": \"future\","
            + " \"subject\": \"A\"}]}";

        DesignManifest manifest = codec.read(json);

        assertEquals(CrossType.CROSS_DIMENSIONAL, manifest.conditions().get("t_trolley_2_ps_b_00c0ffee").crossType());
        assertEquals(CrossType.CROSS_TEMPORAL, manifest.conditions().get("t_trolley_2_ps_a_00c0ffef").crossType());
    }

    @Test
    @DisplayName("older prereg/specs manifest → conditions rebuilt from flat fields and identifier")
    void legacySpecs() throws Exception {
        String json = "{\"prereg\": {\"hash\": \"0123456789abcdef\", \"timestamp\": \"2025-03-01T12:00:00\"},"
            + "\"specs\": ["
            + "{\"custom_id\": \"m_kidney_gift_en_3_pp_PersonA_1a2b3c4d\", \"scenario\": \"kidney_gift\","
            + " \"language\": \"english\", \"is_crosslingual\": false},"
            + "{\"custom_id\": \"x_kidney_gift_enja_ss_b_deadbeef\", \"scenario\": \"kidney_gift\","
            + " \"alpha_lang\": \"en\", \"beta_lang\": \"ja\", \"trial\": 7},"
            + "{\"custom_id\": \"x_orphan\", \"scenario\": \"kidney_gift\", \"lang\": \"en\"}"
            + "]}";

        DesignManifest manifest = codec.read(json);

        assertEquals("0123456789abcdef", manifest.auditHash());
        assertEquals(Instant.parse("2025-03-01T12:00:00Z"), manifest.generatedAt());
        assertEquals(2, manifest.conditions().size());

        TrialCondition mono = manifest.conditions().get("m_kidney_gift_en_3_pp_PersonA_1a2b3c4d");
        assertEquals(CrossType.MONO, mono.crossType());
        assertEquals(MeasurementSetting.PP, mono.setting());
        assertEquals(Party.ALPHA, mono.subject());
        assertEquals(3, mono.trialIndex());

        TrialCondition cross = manifest.conditions().get("x_kidney_gift_enja_ss_b_deadbeef");
        assertEquals(CrossType.CROSS_LINGUAL, cross.crossType());
        assertEquals(Language.JAPANESE, cross.beta().language());
        assertEquals(7, cross.trialIndex());
        assertEquals(Party.BETA, cross.subject());
    }
}
