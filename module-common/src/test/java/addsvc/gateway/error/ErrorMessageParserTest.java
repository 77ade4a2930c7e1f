package addsvc.gateway.error;

import static org.assertj.core.api.Assertions.assertThat;

import addsvc.gateway.error.dto.ErrorDetail;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ErrorMessageParserTest {

  @ParameterizedTest
  @ValueSource(strings = {"boom", "field a: must be positive", "", "  "})
  void alwaysReturnsSingleEntryWithOriginalMessage(String message) {
    List<ErrorDetail> errors = ErrorMessageParser.parse(message);

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).message()).isEqualTo(message);
    assertThat(errors.get(0).field()).isNull();
  }

  @Test
  void nullMessage_becomesEmptyString() {
    assertThat(ErrorMessageParser.parse(null)).containsExactly(ErrorDetail.of(""));
  }
}
