package org.moviegraph.service.ingestion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.moviegraph.configuration.BuildProperties;
import org.moviegraph.models.dto.EquivalencePair;
import org.moviegraph.models.dto.ReferenceData;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ReferenceDataLoader.
 */
@DisplayName("ReferenceDataLoader Tests")
class ReferenceDataLoaderTest {

    private ReferenceData load(BuildProperties properties) {
        return new ReferenceDataLoader(new DefaultResourceLoader(), properties).load();
    }

    @Test
    @DisplayName("Should load the language catalog with English names as extra attribute")
    void testLanguageCatalog() {
        BuildProperties properties = new BuildProperties();
        properties.getCatalogs().put("languages", "classpath:reference/languages.csv");

        List<ReferenceData.CatalogEntry> languages = load(properties).catalog("languages");

        assertEquals(87, languages.size());
        ReferenceData.CatalogEntry chinese = languages.stream()
                .filter(entry -> entry.id().equals("zh"))
                .findFirst()
                .orElseThrow();
        assertEquals("Chinese", chinese.attributes().get("name_en"));
        assertTrue(languages.stream().noneMatch(entry -> entry.id().equals("cn")));
    }

    @Test
    @DisplayName("Should load the shipped company equivalence map")
    void testCompanyMap() {
        BuildProperties properties = new BuildProperties();
        properties.getEquivalences().put("prod_companies", "classpath:reference/company_merge_map.csv");

        List<EquivalencePair> pairs = load(properties).equivalences("prod_companies");

        assertEquals(45, pairs.size());
        assertEquals("36390", pairs.get(0).supersededId());
        assertEquals("787", pairs.get(0).canonicalId());
    }

    @Test
    @DisplayName("Tables without reference data read as empty")
    void testEmpty() {
        ReferenceData data = load(new BuildProperties());
        assertTrue(data.catalog("languages").isEmpty());
        assertTrue(data.equivalences("prod_companies").isEmpty());
    }

    @Test
    @DisplayName("A missing reference file is a state error")
    void testMissingFile() {
        BuildProperties properties = new BuildProperties();
        properties.getEquivalences().put("prod_companies", "classpath:reference/absent.csv");
        assertThrows(IllegalStateException.class, () -> load(properties));
    }
}
