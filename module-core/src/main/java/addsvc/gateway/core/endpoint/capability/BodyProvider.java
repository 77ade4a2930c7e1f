package addsvc.gateway.core.endpoint.capability;

/** 자기 자신 대신 직렬화할 객체를 따로 제공하는 응답 */
public interface BodyProvider {

  Object body();
}
