package tech.andrefsramos.biz_radar.core.domain;

import java.time.Instant;
import java.util.Comparator;

/*
 * Evento efêmero produzido pelo diff de uma varredura. Não é persistido:
 * vira Notification (ou é descartado) no mesmo ciclo.
 * {@code business} é o estado novo, ou o último estado conhecido quando a loja sumiu.
 */
public record ChangeEvent(
        ChangeKind kind,
        String businessId,
        Double oldValue,
        Double newValue,
        Instant detectedAt,
        Business business
) {
    public static final Comparator<ChangeEvent> ORDER =
            Comparator.comparing(ChangeEvent::businessId).thenComparing(ChangeEvent::kind);
}
