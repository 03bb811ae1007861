package tech.andrefsramos.biz_radar.adapters.inbound.api.dto;

public record CountResponse(int updated) {}
