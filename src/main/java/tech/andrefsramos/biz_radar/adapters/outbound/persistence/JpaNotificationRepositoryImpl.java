package tech.andrefsramos.biz_radar.adapters.outbound.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tech.andrefsramos.biz_radar.adapters.outbound.persistence.entity.NotificationEntity;
import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.domain.NotificationQuery;
import tech.andrefsramos.biz_radar.core.ports.NotificationRepository;

import java.time.Clock;
import java.util.List;

/*
 * Implementação JPA das ações do operador sobre notificações e da fila de entrega.
 * Pendente de entrega = deliveredAt nulo e não dispensada; ordem de entrega = mais antiga primeiro.
 */
@Repository
public class JpaNotificationRepositoryImpl implements NotificationRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaNotificationRepositoryImpl.class);

    @PersistenceContext
    private EntityManager em;

    private final Clock clock;

    public JpaNotificationRepositoryImpl(Clock clock) {
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Notification> find(NotificationQuery query) {
        StringBuilder jpql = new StringBuilder("SELECT n FROM NotificationEntity n WHERE 1=1");
        if (!query.includeDismissed()) jpql.append(" AND n.dismissed = false");
        if (query.unreadOnly()) jpql.append(" AND n.read = false");
        if (query.kind() != null) jpql.append(" AND n.kind = :kind");
        jpql.append(" ORDER BY n.updatedAt DESC, n.id DESC");

        TypedQuery<NotificationEntity> q = em.createQuery(jpql.toString(), NotificationEntity.class);
        if (query.kind() != null) q.setParameter("kind", query.kind());
        q.setMaxResults(Math.max(query.limit(), 1));

        return q.getResultList().stream().map(PersistenceMappers::toDomain).toList();
    }

    @Override
    @Transactional
    public boolean markRead(long id) {
        return em.createQuery("UPDATE NotificationEntity n SET n.read = true WHERE n.id = :id")
                .setParameter("id", id)
                .executeUpdate() > 0;
    }

    @Override
    @Transactional
    public boolean dismiss(long id) {
        return em.createQuery("UPDATE NotificationEntity n SET n.dismissed = true, n.read = true WHERE n.id = :id")
                .setParameter("id", id)
                .executeUpdate() > 0;
    }

    @Override
    @Transactional
    public int markAllRead() {
        return em.createQuery("UPDATE NotificationEntity n SET n.read = true WHERE n.read = false AND n.dismissed = false")
                .executeUpdate();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Notification> findPendingDelivery(int limit) {
        return em.createQuery(
                        "SELECT n FROM NotificationEntity n WHERE n.deliveredAt IS NULL AND n.dismissed = false "
                                + "ORDER BY n.updatedAt ASC, n.id ASC", NotificationEntity.class)
                .setMaxResults(Math.max(limit, 1))
                .getResultList()
                .stream()
                .map(PersistenceMappers::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public void markDelivered(List<Long> ids) {
        if (ids == null || ids.isEmpty()) return;
        int updated = em.createQuery("UPDATE NotificationEntity n SET n.deliveredAt = :now WHERE n.id IN :ids")
                .setParameter("now", clock.instant())
                .setParameter("ids", ids)
                .executeUpdate();
        log.info("[JPA] markDelivered ids={} atualizados={}", ids.size(), updated);
    }
}
