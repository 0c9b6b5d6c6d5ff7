package com.ospicorp.forecastapi;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ApiApplicationSmokeTest {

  @Autowired
  private TestRestTemplate restTemplate;

  @Test
  void pingRespondsWithPong() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/v1/ping",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("pong", true);
  }

  @Test
  void rootNamesTheService() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("service", "forecast-service")
        .containsEntry("status", "ok");
  }

  @Test
  void unknownPathIsProblemDetail() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/v1/nothing-here",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody()).containsEntry("status", 404);
  }
}
