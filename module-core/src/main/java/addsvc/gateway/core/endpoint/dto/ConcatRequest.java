package addsvc.gateway.core.endpoint.dto;

public record ConcatRequest(String a, String b) {}
