package tech.andrefsramos.biz_radar.core.domain;

/*
 * Limiares do detector de mudanças.
 *  - ratingChangeThreshold: variação mínima absoluta de nota (escala 0–5).
 *  - removalGraceCount: ausências consecutivas necessárias para considerar a loja removida.
 *  - trendingThreshold: velocidade mínima do sinal de tendência entre duas varreduras.
 */
public record DetectionThresholds(
        double ratingChangeThreshold,
        int removalGraceCount,
        double trendingThreshold
) {
    public static final DetectionThresholds DEFAULTS = new DetectionThresholds(0.3, 2, 0.15);

    public DetectionThresholds {
        if (ratingChangeThreshold < 0 || ratingChangeThreshold > 5) {
            throw new IllegalArgumentException("ratingChangeThreshold must be within [0, 5]");
        }
        if (removalGraceCount < 1) {
            throw new IllegalArgumentException("removalGraceCount must be >= 1");
        }
        if (trendingThreshold <= 0) {
            throw new IllegalArgumentException("trendingThreshold must be > 0");
        }
    }
}
