package addsvc.gateway.error.dto;

import java.util.List;

public record ErrorResItem(int code, String message, List<ErrorDetail> errors) {

  public ErrorResItem {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }
}
