package tech.andrefsramos.biz_radar.core.domain;

import java.time.Instant;

/*
 * Notificação persistida. "Aberta" = não dispensada pelo operador.
 * Existe no máximo uma aberta por par (businessId, kind); businessId é nulo em SYSTEM_STATUS.
 * {@code deliveredAt} nulo indica pendente de entrega aos canais externos.
 */
public record Notification(
        Long id,
        NotificationKind kind,
        String businessId,
        String businessName,
        String title,
        String message,
        Instant createdAt,
        Instant updatedAt,
        boolean read,
        boolean dismissed,
        Instant deliveredAt
) {
    public static Notification open(NotificationKind kind, String businessId, String businessName,
                                    String title, String message, Instant now) {
        return new Notification(null, kind, businessId, businessName, title, message, now, now, false, false, null);
    }

    public boolean isOpen() {
        return !dismissed;
    }

    public boolean sameSubject(NotificationKind otherKind, String otherBusinessId) {
        return kind == otherKind && java.util.Objects.equals(businessId, otherBusinessId);
    }

    public Notification refreshedWith(String newTitle, String newMessage, Instant now) {
        return new Notification(id, kind, businessId, businessName, newTitle, newMessage, createdAt, now,
                false, false, null);
    }
}
