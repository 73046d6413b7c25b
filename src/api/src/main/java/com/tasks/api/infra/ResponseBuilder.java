package com.tasks.api.infra;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds {@link Envelope}s with JSON bodies.
 * <p>
 * Arbitrary-precision numbers are written as plain doubles, so values beyond double precision lose digits.
 */
@Component
public class ResponseBuilder {

  public static final String CONTENT_TYPE = "Content-Type";
  public static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";

  private static final Map<String, String> HEADERS;

  static {
    Map<String, String> h = new LinkedHashMap<>();
    h.put(CONTENT_TYPE, "application/json");
    h.put(ALLOW_ORIGIN, "*");
    HEADERS = h;
  }

  private final ObjectMapper objectMapper;

  public ResponseBuilder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper.copy().registerModule(decimalsAsDoubles());
  }

  public Envelope build(int statusCode, Object body) {
    if (statusCode == 204) {
      return new Envelope(statusCode, HEADERS, "");
    }
    return new Envelope(statusCode, HEADERS, toJson(body));
  }

  public Envelope error(int statusCode, String code, String message) {
    return build(statusCode, ErrorResponse.of(code, message));
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize response: " + e.getOriginalMessage(), e);
    }
  }

  private static SimpleModule decimalsAsDoubles() {
    SimpleModule module = new SimpleModule("decimals-as-doubles");
    module.addSerializer(BigDecimal.class, new JsonSerializer<BigDecimal>() {
      @Override
      public void serialize(BigDecimal value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeNumber(value.doubleValue());
      }
    });
    module.addSerializer(BigInteger.class, new JsonSerializer<BigInteger>() {
      @Override
      public void serialize(BigInteger value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeNumber(value.doubleValue());
      }
    });
    return module;
  }
}
