package tech.andrefsramos.biz_radar.adapters.outbound.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tech.andrefsramos.biz_radar.adapters.outbound.persistence.entity.BusinessEntity;
import tech.andrefsramos.biz_radar.adapters.outbound.persistence.entity.NotificationEntity;
import tech.andrefsramos.biz_radar.adapters.outbound.persistence.entity.ScanRecordEntity;
import tech.andrefsramos.biz_radar.core.domain.Business;
import tech.andrefsramos.biz_radar.core.domain.BusinessQuery;
import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.domain.ScanRecord;
import tech.andrefsramos.biz_radar.core.exception.StorageFailureException;
import tech.andrefsramos.biz_radar.core.ports.SnapshotStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/*
 * JpaSnapshotStoreImpl

 * Finalidade

 * Implementação JPA do {@link SnapshotStore}: snapshot corrente de estabelecimentos, histórico
 * de varreduras e notificações geradas por elas.

 * Como funciona

 * - commitScan(snapshot, record, notifications): uma única transação que
 *   1) aplica o snapshot (upsert dos presentes, delete dos que saíram);
 *   2) persiste o ScanRecord já finalizado;
 *   3) faz upsert das notificações (mesmo ID = atualização da aberta existente).
 *   Qualquer falha vira {@link StorageFailureException} e desfaz tudo; o snapshot anterior
 *   continua valendo.
 * - A coluna competitor de linhas existentes nunca é escrita por varreduras; só
 *   setCompetitorFlag() a altera. Linhas novas entram com false.
 * - Existe no máximo uma notificação aberta por (kind, businessId): uma notificação sem ID
 *   cujo par já tem aberta no banco atualiza a existente. Uma linha já dispensada nunca é
 *   reaberta, mesmo quando a notificação chega com o ID dela.
 * - As entidades usam @DynamicUpdate: o UPDATE gerado pela varredura só leva as colunas
 *   alteradas, então competitor e dismissed gravados em paralelo pelo operador não são sobrescritos.
 */
@Repository
public class JpaSnapshotStoreImpl implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(JpaSnapshotStoreImpl.class);

    @PersistenceContext
    private EntityManager em;

    @Override
    @Transactional(readOnly = true)
    public Map<String, Business> getCurrent() {
        long t0 = System.nanoTime();
        List<BusinessEntity> rows = em.createQuery("SELECT b FROM BusinessEntity b", BusinessEntity.class)
                .getResultList();
        Map<String, Business> out = new TreeMap<>();
        for (BusinessEntity e : rows) {
            out.put(e.getId(), PersistenceMappers.toDomain(e));
        }
        log.debug("[Snapshot] getCurrent itens={} tookMs={}", out.size(), (System.nanoTime() - t0) / 1_000_000);
        return out;
    }

    @Override
    @Transactional
    public ScanRecord commit(Map<String, Business> snapshot, ScanRecord scanRecord) {
        try {
            applySnapshot(snapshot);
            ScanRecord saved = persistRecord(scanRecord);
            em.flush();
            return saved;
        } catch (RuntimeException e) {
            throw storageFailure("commit", e);
        }
    }

    @Override
    @Transactional
    public List<Notification> recordNotifications(List<Notification> notifications) {
        try {
            List<Notification> saved = upsertNotifications(notifications);
            em.flush();
            return saved;
        } catch (RuntimeException e) {
            throw storageFailure("recordNotifications", e);
        }
    }

    @Override
    @Transactional
    public ScanRecord commitScan(Map<String, Business> snapshot, ScanRecord scanRecord, List<Notification> notifications) {
        final long t0 = System.nanoTime();
        try {
            int[] counts = applySnapshot(snapshot);
            ScanRecord saved = persistRecord(scanRecord);
            List<Notification> notes = upsertNotifications(notifications);
            em.flush();
            log.info("[Snapshot] Commit concluído scanId={} inseridos={} atualizados={} removidos={} notificações={} tookMs={}",
                    saved.id(), counts[0], counts[1], counts[2], notes.size(), (System.nanoTime() - t0) / 1_000_000);
            return saved;
        } catch (RuntimeException e) {
            throw storageFailure("commitScan", e);
        }
    }

    @Override
    @Transactional
    public ScanRecord recordAbortedScan(ScanRecord scanRecord, List<Notification> notifications) {
        try {
            ScanRecord saved = persistRecord(scanRecord);
            upsertNotifications(notifications);
            em.flush();
            log.info("[Snapshot] Varredura sem commit registrada scanId={} outcome={}", saved.id(), saved.outcome());
            return saved;
        } catch (RuntimeException e) {
            throw storageFailure("recordAbortedScan", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Notification> findOpenNotifications() {
        return em.createQuery(
                        "SELECT n FROM NotificationEntity n WHERE n.dismissed = false ORDER BY n.id", NotificationEntity.class)
                .getResultList()
                .stream()
                .map(PersistenceMappers::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScanRecord> findScanHistory(int limit) {
        return em.createQuery(
                        "SELECT s FROM ScanRecordEntity s ORDER BY s.startedAt DESC, s.id DESC", ScanRecordEntity.class)
                .setMaxResults(Math.max(limit, 1))
                .getResultList()
                .stream()
                .map(PersistenceMappers::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ScanRecord> findLastScan() {
        return findScanHistory(1).stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Business> findBusinesses(BusinessQuery query) {
        BusinessQuery q = query == null ? BusinessQuery.all() : query;

        StringBuilder jpql = new StringBuilder("SELECT b FROM BusinessEntity b WHERE 1=1");
        Map<String, Object> params = new HashMap<>();

        if (q.competitorsOnly()) {
            jpql.append(" AND b.competitor = true");
        }
        if (q.category() != null) {
            jpql.append(" AND b.category = :category");
            params.put("category", q.category());
        }
        if (q.minRating() != null) {
            jpql.append(" AND b.rating >= :minRating");
            params.put("minRating", q.minRating());
        }
        if (q.nameContains() != null && !q.nameContains().isBlank()) {
            jpql.append(" AND LOWER(b.name) LIKE :name");
            params.put("name", "%" + q.nameContains().trim().toLowerCase(Locale.ROOT) + "%");
        }
        jpql.append(" ORDER BY LOWER(b.name), b.id");

        TypedQuery<BusinessEntity> tq = em.createQuery(jpql.toString(), BusinessEntity.class);
        params.forEach(tq::setParameter);

        return tq.getResultList().stream().map(PersistenceMappers::toDomain).toList();
    }

    @Override
    @Transactional
    public boolean setCompetitorFlag(String businessId, boolean competitor) {
        int updated = em.createQuery("UPDATE BusinessEntity b SET b.competitor = :c WHERE b.id = :id")
                .setParameter("c", competitor)
                .setParameter("id", businessId)
                .executeUpdate();
        log.debug("[Snapshot] setCompetitorFlag id={} competitor={} linhas={}", businessId, competitor, updated);
        return updated > 0;
    }

    /* Retorna {inseridos, atualizados, removidos}. */
    private int[] applySnapshot(Map<String, Business> snapshot) {
        Map<String, Business> next = snapshot == null ? Map.of() : snapshot;

        Map<String, BusinessEntity> existing = new HashMap<>();
        for (BusinessEntity e : em.createQuery("SELECT b FROM BusinessEntity b", BusinessEntity.class).getResultList()) {
            existing.put(e.getId(), e);
        }

        int inserted = 0, updated = 0, removed = 0;
        for (Business b : next.values()) {
            BusinessEntity e = existing.remove(b.id());
            if (e == null) {
                e = new BusinessEntity();
                PersistenceMappers.copyObserved(b, e);
                e.setCompetitor(false);
                em.persist(e);
                inserted++;
            } else {
                PersistenceMappers.copyObserved(b, e);
                updated++;
            }
        }
        for (BusinessEntity gone : existing.values()) {
            em.remove(gone);
            removed++;
        }
        return new int[]{inserted, updated, removed};
    }

    private ScanRecord persistRecord(ScanRecord record) {
        if (record == null || !record.outcome().isFinal()) {
            throw new IllegalArgumentException("Only finalized scan records can be persisted");
        }
        ScanRecordEntity e = PersistenceMappers.toEntity(record);
        em.persist(e);
        return record.withId(e.getId());
    }

    private List<Notification> upsertNotifications(List<Notification> notifications) {
        if (notifications == null || notifications.isEmpty()) return List.of();

        List<Notification> out = new ArrayList<>(notifications.size());
        for (Notification n : notifications) {
            NotificationEntity e = n.id() != null ? em.find(NotificationEntity.class, n.id()) : null;
            if (e != null && e.isDismissed()) {
                // dispensada depois da leitura da varredura: continua dispensada, a ocorrência abre outra
                log.debug("[Snapshot] Notificação id={} dispensada durante a varredura; abrindo nova.", e.getId());
                e = null;
            }
            if (e == null) {
                e = findOpen(n).orElseGet(NotificationEntity::new);
            }
            boolean insert = e.getId() == null;
            PersistenceMappers.copy(n, e);
            if (insert) {
                em.persist(e);
            }
            out.add(PersistenceMappers.toDomain(e));
        }
        return out;
    }

    private Optional<NotificationEntity> findOpen(Notification n) {
        String jpql = n.businessId() == null
                ? "SELECT n FROM NotificationEntity n WHERE n.kind = :kind AND n.businessId IS NULL AND n.dismissed = false"
                : "SELECT n FROM NotificationEntity n WHERE n.kind = :kind AND n.businessId = :bid AND n.dismissed = false";
        TypedQuery<NotificationEntity> q = em.createQuery(jpql, NotificationEntity.class).setParameter("kind", n.kind());
        if (n.businessId() != null) {
            q.setParameter("bid", n.businessId());
        }
        List<NotificationEntity> found = q.setMaxResults(1).getResultList();
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    private static StorageFailureException storageFailure(String op, RuntimeException e) {
        if (e instanceof StorageFailureException sfe) return sfe;
        log.error("[Snapshot] Falha em {}: {}", op, e.getMessage(), e);
        return new StorageFailureException("Storage failure during " + op + ": " + e.getMessage(), e);
    }
}
