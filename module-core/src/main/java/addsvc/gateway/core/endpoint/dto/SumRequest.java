package addsvc.gateway.core.endpoint.dto;

public record SumRequest(long a, long b) {}
