package tech.andrefsramos.biz_radar.core.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.domain.NotificationKind;
import tech.andrefsramos.biz_radar.core.domain.NotificationQuery;
import tech.andrefsramos.biz_radar.core.domain.NotificationSummary;
import tech.andrefsramos.biz_radar.core.ports.NotificationRepository;

import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static tech.andrefsramos.biz_radar.support.Fixtures.T0;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationService")
class NotificationServiceTest {

    @Mock
    private NotificationRepository repository;

    private NotificationService service;

    @BeforeEach
    void setUp() {
        service = new NotificationService(repository);
    }

    private static Notification note(long id, NotificationKind kind, boolean read) {
        return new Notification(id, kind, "B" + id, "Loja", "t", "m", T0, T0, read, false, null);
    }

    @Test
    @DisplayName("List clamps the limit to the maximum page size")
    void listClampsLimit() {
        when(repository.find(any())).thenReturn(List.of());

        service.list(new NotificationQuery(true, false, NotificationKind.RATING_CHANGED, 10_000));

        ArgumentCaptor<NotificationQuery> captor = ArgumentCaptor.forClass(NotificationQuery.class);
        verify(repository).find(captor.capture());
        assertThat(captor.getValue().limit()).isEqualTo(NotificationService.MAX_LIMIT);
        assertThat(captor.getValue().unreadOnly()).isTrue();
        assertThat(captor.getValue().kind()).isEqualTo(NotificationKind.RATING_CHANGED);
    }

    @Test
    @DisplayName("Unknown ids are reported for markRead and dismiss")
    void unknownIds() {
        when(repository.markRead(99L)).thenReturn(false);
        when(repository.dismiss(99L)).thenReturn(false);

        assertThatThrownBy(() -> service.markRead(99L)).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> service.dismiss(99L)).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    @DisplayName("Summary counts open notifications, unread ones and kinds")
    void summary() {
        when(repository.find(any())).thenReturn(List.of(
                note(1, NotificationKind.NEW_BUSINESS, false),
                note(2, NotificationKind.NEW_BUSINESS, true),
                note(3, NotificationKind.SYSTEM_STATUS, false)));

        NotificationSummary summary = service.summary();

        assertThat(summary.total()).isEqualTo(3);
        assertThat(summary.unread()).isEqualTo(2);
        assertThat(summary.byKind()).containsOnly(
                entry(NotificationKind.NEW_BUSINESS, 2),
                entry(NotificationKind.SYSTEM_STATUS, 1));
    }

    @Test
    @DisplayName("markAllRead returns the number of updated notifications")
    void markAllRead() {
        when(repository.markAllRead()).thenReturn(4);

        assertThat(service.markAllRead()).isEqualTo(4);
    }
}
