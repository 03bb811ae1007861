package tech.andrefsramos.biz_radar.adapters.outbound.persistence;

import tech.andrefsramos.biz_radar.adapters.outbound.persistence.entity.BusinessEntity;
import tech.andrefsramos.biz_radar.adapters.outbound.persistence.entity.NotificationEntity;
import tech.andrefsramos.biz_radar.adapters.outbound.persistence.entity.ScanRecordEntity;
import tech.andrefsramos.biz_radar.core.domain.Business;
import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.domain.ScanRecord;

import java.util.Arrays;
import java.util.List;

/* Conversões entidade <-> domínio compartilhadas pelos repositórios JPA. */
final class PersistenceMappers {

    private static final String LABEL_SEPARATOR = "|";

    private PersistenceMappers() {}

    static Business toDomain(BusinessEntity e) {
        return new Business(
                e.getId(),
                e.getName(),
                e.getCategory(),
                splitLabels(e.getCategoryLabels()),
                e.getLatitude(),
                e.getLongitude(),
                e.getAddress(),
                e.getRating(),
                e.getPriceTier(),
                e.isVerified(),
                e.getHours(),
                e.getPopularity(),
                e.getTotalRatings(),
                e.getWebsite(),
                e.getPhone(),
                e.isCompetitor(),
                e.getFirstSeenAt(),
                e.getLastSeenAt(),
                e.getMissedScans()
        );
    }

    /* Copia os dados observados. A flag de concorrente não é tocada aqui. */
    static void copyObserved(Business b, BusinessEntity e) {
        e.setId(b.id());
        e.setName(b.name());
        e.setCategory(b.category());
        e.setCategoryLabels(String.join(LABEL_SEPARATOR, b.categoryLabels()));
        e.setLatitude(b.latitude());
        e.setLongitude(b.longitude());
        e.setAddress(b.address());
        e.setRating(b.rating());
        e.setPriceTier(b.priceTier());
        e.setVerified(b.verified());
        e.setHours(b.hours());
        e.setPopularity(b.popularity());
        e.setTotalRatings(b.totalRatings());
        e.setWebsite(b.website());
        e.setPhone(b.phone());
        e.setFirstSeenAt(b.firstSeenAt());
        e.setLastSeenAt(b.lastSeenAt());
        e.setMissedScans(b.missedScans());
    }

    static ScanRecord toDomain(ScanRecordEntity e) {
        return new ScanRecord(
                e.getId(),
                e.getStartedAt(),
                e.getFinishedAt(),
                e.getOutcome(),
                e.getFetchedCount(),
                e.getNewCount(),
                e.getChangedCount(),
                e.getRemovedCount(),
                e.getErrorKind(),
                e.getErrorDetail()
        );
    }

    static ScanRecordEntity toEntity(ScanRecord r) {
        ScanRecordEntity e = new ScanRecordEntity();
        e.setStartedAt(r.startedAt());
        e.setFinishedAt(r.finishedAt());
        e.setOutcome(r.outcome());
        e.setFetchedCount(r.fetchedCount());
        e.setNewCount(r.newCount());
        e.setChangedCount(r.changedCount());
        e.setRemovedCount(r.removedCount());
        e.setErrorKind(r.errorKind());
        e.setErrorDetail(r.errorDetail());
        return e;
    }

    static Notification toDomain(NotificationEntity e) {
        return new Notification(
                e.getId(),
                e.getKind(),
                e.getBusinessId(),
                e.getBusinessName(),
                e.getTitle(),
                e.getMessage(),
                e.getCreatedAt(),
                e.getUpdatedAt(),
                e.isRead(),
                e.isDismissed(),
                e.getDeliveredAt()
        );
    }

    static void copy(Notification n, NotificationEntity e) {
        e.setKind(n.kind());
        e.setBusinessId(n.businessId());
        e.setBusinessName(n.businessName());
        e.setTitle(n.title());
        e.setMessage(n.message());
        if (e.getCreatedAt() == null) {
            e.setCreatedAt(n.createdAt() != null ? n.createdAt() : n.updatedAt());
        }
        e.setUpdatedAt(n.updatedAt());
        e.setRead(n.read());
        e.setDismissed(n.dismissed());
        e.setDeliveredAt(n.deliveredAt());
    }

    private static List<String> splitLabels(String joined) {
        if (joined == null || joined.isBlank()) return List.of();
        return Arrays.stream(joined.split("\\|"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
