package addsvc.gateway.transport.http;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.emptyString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import addsvc.gateway.global.filter.MDCFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * add API 통합 테스트 (서블릿 필터 + 엔드포인트 체인 + 에러 인코더)
 *
 * <ul>
 *   <li>sum / concat 정상 응답
 *   <li>잘못된 본문, long 범위 밖 피연산자 → 400, 토큰 누락 → 401
 *   <li>도메인 에러(overflow, 길이 초과) → 500 + 구조화된 errors
 * </ul>
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("AddHttpController 통합 테스트")
class AddHttpControllerTest {

  private static final String BEARER = "Bearer test-token";

  @Autowired private MockMvc mockMvc;

  @Nested
  @DisplayName("정상 호출")
  class SuccessTests {

    @Test
    void sum() throws Exception {
      mockMvc
          .perform(
              post("/api/add/sum")
                  .header(HttpHeaders.AUTHORIZATION, BEARER)
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"a\":2,\"b\":3}"))
          .andExpect(status().isOk())
          .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
          .andExpect(content().json("{\"res\":5}", true));
    }

    @Test
    void concat() throws Exception {
      mockMvc
          .perform(
              post("/api/add/concat")
                  .header(HttpHeaders.AUTHORIZATION, BEARER)
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"a\":\"foo\",\"b\":\"bar\"}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.res").value("foobar"));
    }

    @Test
    @DisplayName("Correlation ID를 응답 헤더로 돌려준다")
    void echoesCorrelationId() throws Exception {
      mockMvc
          .perform(
              post("/api/add/sum")
                  .header(HttpHeaders.AUTHORIZATION, BEARER)
                  .header(MDCFilter.CORRELATION_ID_HEADER, "corr-1")
                  .content("{\"a\":1,\"b\":1}"))
          .andExpect(status().isOk())
          .andExpect(header().string(MDCFilter.CORRELATION_ID_HEADER, "corr-1"));
    }
  }

  @Nested
  @DisplayName("에러 응답")
  class ErrorTests {

    @Test
    @DisplayName("JSON이 아닌 본문은 400")
    void malformedBodyIsBadRequest() throws Exception {
      mockMvc
          .perform(
              post("/api/add/sum")
                  .header(HttpHeaders.AUTHORIZATION, BEARER)
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("not-json"))
          .andExpect(status().isBadRequest())
          .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
          .andExpect(jsonPath("$.error.code").value(400))
          .andExpect(jsonPath("$.error.errors", hasSize(1)))
          .andExpect(jsonPath("$.error.message", not(emptyString())));
    }

    @Test
    @DisplayName("본문이 없으면 400")
    void emptyBodyIsBadRequest() throws Exception {
      mockMvc
          .perform(post("/api/add/concat").header(HttpHeaders.AUTHORIZATION, BEARER))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.error.code").value(400));
    }

    @ParameterizedTest
    @ValueSource(
        strings = {
          "{\"a\":99999999999999999999,\"b\":1}",
          "{\"a\":-99999999999999999999,\"b\":1}",
          "{\"a\":2.9,\"b\":3}",
          "{\"a\":\"2\",\"b\":3}"
        })
    @DisplayName("long 범위 밖이거나 정수가 아닌 피연산자는 400")
    void nonLongOperandIsBadRequest(String body) throws Exception {
      mockMvc
          .perform(
              post("/api/add/sum")
                  .header(HttpHeaders.AUTHORIZATION, BEARER)
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(body))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.error.code").value(400))
          .andExpect(jsonPath("$.error.errors", hasSize(1)));
    }

    @Test
    @DisplayName("1000자리를 넘는 숫자도 400")
    void overlongNumberIsBadRequest() throws Exception {
      mockMvc
          .perform(
              post("/api/add/sum")
                  .header(HttpHeaders.AUTHORIZATION, BEARER)
                  .content("{\"a\":" + "9".repeat(1001) + ",\"b\":1}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.error.code").value(400));
    }

    @Test
    @DisplayName("concat에 숫자 피연산자는 400")
    void numericConcatOperandIsBadRequest() throws Exception {
      mockMvc
          .perform(
              post("/api/add/concat")
                  .header(HttpHeaders.AUTHORIZATION, BEARER)
                  .content("{\"a\":1,\"b\":\"x\"}"))
          .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("토큰이 없으면 401")
    void missingTokenIsUnauthorized() throws Exception {
      mockMvc
          .perform(
              post("/api/add/sum")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"a\":2,\"b\":3}"))
          .andExpect(status().isUnauthorized())
          .andExpect(jsonPath("$.error.code").value(401))
          .andExpect(
              jsonPath("$.error.message").value("token up for parsing was not found in context"));
    }

    @Test
    @DisplayName("overflow는 500 + res 필드 에러")
    void overflowIsDomainError() throws Exception {
      mockMvc
          .perform(
              post("/api/add/sum")
                  .header(HttpHeaders.AUTHORIZATION, BEARER)
                  .content("{\"a\":9223372036854775807,\"b\":1}"))
          .andExpect(status().isInternalServerError())
          .andExpect(jsonPath("$.error.message").value("integer overflow"))
          .andExpect(jsonPath("$.error.errors[0].field").value("res"));
    }

    @Test
    @DisplayName("최대 길이를 넘는 concat은 500")
    void tooLongConcatIsDomainError() throws Exception {
      String big = "x".repeat(1024);
      mockMvc
          .perform(
              post("/api/add/concat")
                  .header(HttpHeaders.AUTHORIZATION, BEARER)
                  .content("{\"a\":\"" + big + "\",\"b\":\"y\"}"))
          .andExpect(status().isInternalServerError())
          .andExpect(jsonPath("$.error.message").value("result exceeds maximum size"))
          .andExpect(jsonPath("$.error.errors[0].message").value("max length 1024"));
    }
  }
}
