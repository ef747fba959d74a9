package com.novelforge.settings;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NovelConfigTest {

    private static NovelConfig valid() {
        NovelConfig config = new NovelConfig();
        config.setProjectName("Tides");
        config.setTheme("A town that forgets every high tide");
        return config;
    }

    @Test
    void defaultsDescribeANovel() {
        NovelConfig config = valid();
        config.validate();

        assertEquals(NovelLength.NOVEL, config.getNovelLength());
        assertEquals("Novel", config.lengthDescription());
        assertTrue(config.getCheckpoints().isRequirePlanApproval());
        assertEquals("kimi-k2-thinking", config.getApi().getModelId());
    }

    @Test
    void customLengthNeedsAWordCount() {
        NovelConfig config = valid();
        config.setNovelLength(NovelLength.CUSTOM);
        assertThrows(IllegalArgumentException.class, config::validate);

        config.setCustomWordCount(42000);
        config.validate();
        assertEquals("Custom (42,000 words)", config.lengthDescription());
    }

    @Test
    void rejectsMissingFieldsAndInconsistentLimits() {
        NovelConfig noName = valid();
        noName.setProjectName("");
        assertThrows(IllegalArgumentException.class, noName::validate);

        NovelConfig threshold = valid();
        threshold.getApi().setCompressionThreshold(threshold.getApi().getTokenLimit());
        assertThrows(IllegalArgumentException.class, threshold::validate);
    }

    @Test
    void readsConfigWithUnknownFieldsAndMissingSections() throws Exception {
        String json = "{\"projectName\":\"Tides\",\"theme\":\"Forgetting\",\"legacyField\":true}";

        NovelConfig config = new ObjectMapper().readValue(json, NovelConfig.class);

        assertEquals("Tides", config.getProjectName());
        assertNotNull(config.getApi());
        assertNotNull(config.getAgent());
    }

    @Test
    void modelCatalogRoutesModelsToProviders() {
        assertEquals("moonshot", ModelCatalog.providerFor("kimi-k2-thinking"));
        assertEquals("deepinfra", ModelCatalog.providerFor("zai-org/GLM-4.6"));
        assertEquals("moonshot", ModelCatalog.providerFor("something-else"));
    }
}
