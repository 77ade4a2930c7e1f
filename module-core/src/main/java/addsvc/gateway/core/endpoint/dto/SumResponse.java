package addsvc.gateway.core.endpoint.dto;

public record SumResponse(long res) {}
