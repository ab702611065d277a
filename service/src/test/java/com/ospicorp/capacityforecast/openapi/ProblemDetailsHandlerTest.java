package com.ospicorp.capacityforecast.openapi;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.capacityforecast.Fixtures;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ProblemDetailsHandlerTest {

  @Autowired
  private TestRestTemplate rest;

  private ResponseEntity<Map> post(String path, Object body) {
    return rest.postForEntity(path, body, Map.class);
  }

  private static void assertProblem(ResponseEntity<Map> response, HttpStatus status) {
    assertThat(response.getStatusCode()).isEqualTo(status);
    assertThat(response.getHeaders().getContentType()).isNotNull();
    assertThat(response.getHeaders().getContentType().toString())
        .contains("application/problem+json");
    assertThat(response.getBody()).containsKeys("type", "title", "status", "detail", "instance");
  }

  @Test
  void invalidParameterCarriesErrorCode() {
    var body = Map.of("rows", Fixtures.daily("a", 40, i -> i),
        "options", Map.of("horizon", 0));

    ResponseEntity<Map> response = post("/v1/backtests", body);

    assertProblem(response, HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("error_code", 2001)
        .containsEntry("parameter", "horizon");
    assertThat((String) response.getBody().get("more_info")).endsWith("/2001");
  }

  @Test
  void unknownModelIsABadRequest() {
    var body = Map.of("rows", Fixtures.daily("a", 40, i -> i),
        "options", Map.of("models", List.of("Prophet")));

    ResponseEntity<Map> response = post("/v1/backtests", body);

    assertProblem(response, HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("error_code", 2009);
  }

  @Test
  void malformedTimestampIsABadRequest() {
    var body = Map.of("rows", List.of(
        Map.of("series_id", "a", "timestamp", "31/12/2024", "value", 1)));

    ResponseEntity<Map> response = post("/v1/backtests", body);

    assertProblem(response, HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("series_id", "a");
    assertThat((String) response.getBody().get("type")).endsWith("/malformed-timestamp");
  }

  @Test
  void noEligibleSeriesIsUnprocessable() {
    var body = Map.of("rows", Fixtures.daily("a", 10, i -> i));

    ResponseEntity<Map> response = post("/v1/backtests", body);

    assertProblem(response, HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody()).containsKey("dropped_series");
  }

  @Test
  void missingRowsFailValidation() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    ResponseEntity<Map> response = rest.postForEntity("/v1/backtests",
        new HttpEntity<>("{}", headers), Map.class);

    assertProblem(response, HttpStatus.BAD_REQUEST);
  }
}
