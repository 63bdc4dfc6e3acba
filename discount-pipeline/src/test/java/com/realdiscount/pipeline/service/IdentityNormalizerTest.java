package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.model.NormalizedIdentity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IdentityNormalizerTest {

    private final IdentityNormalizer normalizer = new IdentityNormalizer();

    @Test
    public void normalizeTextStripsAccentsAndCollapsesSpaces() {
        assertEquals("creme solaire", normalizer.normalizeText("  Crème   SOLAIRE "));
        assertEquals("", normalizer.normalizeText(null));
    }

    @Test
    public void brandAliasesMapToOneSpelling() {
        assertEquals("la roche-posay", normalizer.normalizeBrand("La Roche Posay"));
        assertEquals("la roche-posay", normalizer.normalizeBrand("LA ROCHE-POSAY"));
        assertEquals("l'oreal paris", normalizer.normalizeBrand("L'Oréal"));
        assertEquals("", normalizer.normalizeBrand("   "));
    }

    @Test
    public void unknownBrandIsKeptNormalized() {
        assertEquals("nivea", normalizer.normalizeBrand(" NIVEA "));
    }

    @Test
    public void parsesSizesIntoCanonicalUnits() {
        IdentityNormalizer.Size litres = normalizer.parseSize("1,5 L");
        assertEquals(1500.0, litres.value());
        assertEquals("ml", litres.unit());

        IdentityNormalizer.Size kilos = normalizer.parseSize("1 kg");
        assertEquals(1000.0, kilos.value());
        assertEquals("g", kilos.unit());

        IdentityNormalizer.Size units = normalizer.parseSize("30 capsulas");
        assertEquals(30.0, units.value());
        assertEquals("un", units.unit());
    }

    @Test
    public void unparsableSizeIsUnknown() {
        IdentityNormalizer.Size size = normalizer.parseSize("tamaño grande");
        assertNull(size.value());
        assertNull(size.unit());
        assertNull(normalizer.parseSize(null).value());
    }

    @Test
    public void categoryFallsBackToTitleThenOther() {
        assertEquals("sunscreen", normalizer.normalizeCategory("Protección Solar", "Fluido"));
        assertEquals("sunscreen", normalizer.normalizeCategory(null, "Anthelios protector FPS 50"));
        assertEquals("other", normalizer.normalizeCategory("Maquillaje", "Labial rojo"));
    }

    @Test
    public void eanKeepsDigitsOnlyWhenLengthIsPlausible() {
        assertEquals("7801234567890", normalizer.normalizeEan("780-1234-567890"));
        assertNull(normalizer.normalizeEan("12345"));
        assertNull(normalizer.normalizeEan(null));
    }

    @Test
    public void normalizeRemovesBrandAndSizeFromName() {
        NormalizedIdentity id = normalizer.normalize(
                "La Roche Posay Anthelios UVMune 400 Fluido FPS50+ 50ml",
                "La Roche-Posay", null, "Protección Solar", null);

        assertEquals("la roche-posay", id.brand());
        assertEquals("anthelios uvmune 400 fluido fps50", id.name());
        assertEquals(50.0, id.sizeValue());
        assertEquals("ml", id.sizeUnit());
        assertEquals("sunscreen", id.category());
        assertTrue(id.tokens().contains("anthelios"));
        assertNull(id.ean());
    }

    @Test
    public void stopWordsAreNotTokens() {
        assertFalse(normalizer.nameTokens("crema de manos para piel seca").contains("de"));
        assertTrue(normalizer.nameTokens("crema de manos para piel seca").contains("manos"));
        assertTrue(normalizer.nameTokens(null).isEmpty());
    }
}
