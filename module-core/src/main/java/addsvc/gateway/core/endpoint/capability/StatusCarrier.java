package addsvc.gateway.core.endpoint.capability;

/** 200 대신 명시적인 상태 코드를 갖는 응답. 204면 본문을 쓰지 않습니다. */
public interface StatusCarrier {

  int statusCode();
}
