package tech.andrefsramos.biz_radar.adapters.inbound.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.andrefsramos.biz_radar.adapters.inbound.api.dto.CountResponse;
import tech.andrefsramos.biz_radar.core.application.NotificationsUseCase;
import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.domain.NotificationKind;
import tech.andrefsramos.biz_radar.core.domain.NotificationQuery;
import tech.andrefsramos.biz_radar.core.domain.NotificationSummary;

import java.util.List;

@RestController
@RequestMapping("/api/v1/notifications")
@Tag(name = "02 - Notificações")
public class NotificationsController {

    private final NotificationsUseCase notifications;

    public NotificationsController(NotificationsUseCase notifications) {
        this.notifications = notifications;
    }

    @GetMapping
    @Operation(
            summary = "Lista notificações, mais recentes primeiro",
            description = """
        Por padrão retorna apenas notificações abertas (não dispensadas).
        `limit` é limitado a **500**.
        """
    )
    public List<Notification> list(
            @Parameter(description = "Somente não lidas") @RequestParam(defaultValue = "false") boolean unreadOnly,
            @Parameter(description = "Inclui dispensadas") @RequestParam(defaultValue = "false") boolean includeDismissed,
            @Parameter(description = "Tipo da notificação", example = "RATING_CHANGED")
            @RequestParam(required = false) NotificationKind kind,
            @Parameter(description = "Máximo de itens", example = "50") @RequestParam(defaultValue = "50") int limit
    ) {
        return notifications.list(new NotificationQuery(unreadOnly, includeDismissed, kind, limit));
    }

    @GetMapping("/summary")
    @Operation(summary = "Totais de notificações abertas, não lidas e por tipo")
    public NotificationSummary summary() {
        return notifications.summary();
    }

    @PostMapping("/{id}/read")
    @Operation(summary = "Marca uma notificação como lida", security = @SecurityRequirement(name = "basicAuth"),
            responses = {
                    @ApiResponse(responseCode = "204", description = "Marcada."),
                    @ApiResponse(responseCode = "404", description = "ID desconhecido.")
            })
    public ResponseEntity<Void> markRead(@PathVariable long id) {
        notifications.markRead(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/dismiss")
    @Operation(summary = "Dispensa uma notificação", security = @SecurityRequirement(name = "basicAuth"),
            description = "Uma notificação dispensada deixa de ser a aberta do par (estabelecimento, tipo); "
                    + "a próxima ocorrência gera uma nova.")
    public ResponseEntity<Void> dismiss(@PathVariable long id) {
        notifications.dismiss(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/read-all")
    @Operation(summary = "Marca todas as abertas como lidas", security = @SecurityRequirement(name = "basicAuth"))
    public CountResponse markAllRead() {
        return new CountResponse(notifications.markAllRead());
    }
}
