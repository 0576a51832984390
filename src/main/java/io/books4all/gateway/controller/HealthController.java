package io.books4all.gateway.controller;

import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class HealthController {

  @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<Map<String, String>> health() {
    return Mono.just(Map.of("status", "ok"));
  }
}
