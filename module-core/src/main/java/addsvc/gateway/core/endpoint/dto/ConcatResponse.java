package addsvc.gateway.core.endpoint.dto;

public record ConcatResponse(String res) {}
