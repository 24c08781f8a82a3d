package ch.lexcite.client.cantonal;

import java.util.Map;
import java.util.Optional;

import ch.lexcite.storage.CourtLevel;

/**
 * Courts known by their entscheidsuche.ch spider name (second hierarchy level).
 */
final class CourtDirectory {

    record Court(String name, String canton, CourtLevel level) {}

    static final Map<String, Court> COURTS = Map.ofEntries(
        federal("CH_BGer", "Bundesgericht / Tribunal fédéral"),
        federal("CH_BGE", "Bundesgericht (BGE)"),
        federal("CH_BVGer", "Bundesverwaltungsgericht"),
        federal("CH_BPatGer", "Bundespatentgericht"),
        federal("CH_BStGer", "Bundesstrafgericht"),
        cantonal("ZH_OG", "Obergericht Zürich", "ZH"),
        cantonal("ZH_VG", "Verwaltungsgericht Zürich", "ZH"),
        cantonal("ZH_BK", "Bezirksgerichte Zürich", "ZH"),
        cantonal("BE_OG", "Obergericht Bern", "BE"),
        cantonal("BE_VG", "Verwaltungsgericht Bern", "BE"),
        cantonal("GE_CJ", "Cour de justice de Genève", "GE"),
        cantonal("GE_TAPI", "Tribunal administratif Genève", "GE"),
        cantonal("BS_AG", "Appellationsgericht Basel-Stadt", "BS"),
        cantonal("VD_TC", "Tribunal cantonal Vaud", "VD"),
        cantonal("TI_CRP2", "Tribunale d'appello Ticino", "TI"),
        cantonal("SG_OG", "Kantonsgericht St. Gallen", "SG"),
        cantonal("AG_OG", "Obergericht Aargau", "AG"),
        cantonal("LU_KG", "Kantonsgericht Luzern", "LU"));

    private CourtDirectory() {
    }

    private static Map.Entry<String, Court> federal(String spider, String name) {
        return Map.entry(spider, new Court(name, "CH", CourtLevel.FEDERAL));
    }

    private static Map.Entry<String, Court> cantonal(String spider, String name, String canton) {
        return Map.entry(spider, new Court(name, canton, CourtLevel.CANTONAL));
    }

    static Optional<Court> bySpider(String spider) {
        return spider == null ? Optional.empty() : Optional.ofNullable(COURTS.get(spider));
    }

    static boolean isFederalSupremeCourt(String spider) {
        return "CH_BGer".equals(spider) || "CH_BGE".equals(spider);
    }

    /**
     * Derives the spider from a signature or document id: the first two
     * underscore-separated parts, e.g. {@code CH_BGer_004_4A-120-2022} gives {@code CH_BGer}.
     *
     * @return the spider, or empty when the id has fewer than two parts
     */
    static Optional<String> spiderOf(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String[] parts = id.split("_");
        if (parts.length < 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(parts[0] + "_" + parts[1]);
    }
}
