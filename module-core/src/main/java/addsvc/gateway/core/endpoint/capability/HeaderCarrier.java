package addsvc.gateway.core.endpoint.capability;

import java.util.List;
import java.util.Map;

/** 응답 본문 전에 추가 헤더를 내보내야 하는 응답 */
public interface HeaderCarrier {

  Map<String, List<String>> headers();
}
