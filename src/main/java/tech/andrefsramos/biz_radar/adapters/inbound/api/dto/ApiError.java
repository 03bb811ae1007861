package tech.andrefsramos.biz_radar.adapters.inbound.api.dto;

import java.util.List;

public record ApiError(String error, String message, List<String> details) {

    public static ApiError of(String error, String message) {
        return new ApiError(error, message, List.of());
    }
}
