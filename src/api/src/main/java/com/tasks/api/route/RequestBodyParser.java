package com.tasks.api.route;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Lenient body parsing: a missing, blank or malformed body, or JSON that is not an object,
 * all yield an empty object, meaning "no fields given". Parsing never fails a request.
 */
@Component
@RequiredArgsConstructor
public class RequestBodyParser {

  private static final Logger log = LoggerFactory.getLogger(RequestBodyParser.class);

  private final ObjectMapper objectMapper;

  public ObjectNode parse(String body) {
    if (body == null || body.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      JsonNode node = objectMapper.readTree(body);
      if (node instanceof ObjectNode obj) {
        return obj;
      }
      log.debug("Request body is not a JSON object, treating as empty");
    } catch (JsonProcessingException e) {
      log.debug("Request body is not valid JSON, treating as empty: {}", e.getOriginalMessage());
    }
    return objectMapper.createObjectNode();
  }
}
