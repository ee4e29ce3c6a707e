package dev.workflowcron.scheduler.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public class JSONUtil {

  private static final ObjectMapper mapper = new ObjectMapper();

  public static class JsonRuntimeException extends RuntimeException {
    public JsonRuntimeException(JsonProcessingException cause) {
      super(cause.getMessage(), cause);
      setStackTrace(cause.getStackTrace());
      for (Throwable suppressed : cause.getSuppressed()) {
        addSuppressed(suppressed);
      }
    }
  }

  static {
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  public static ObjectMapper mapper() {
    return mapper;
  }

  public static String toJson(Object obj) {
    try {
      return mapper.writeValueAsString(obj);
    } catch (JsonProcessingException e) {
      throw new JsonRuntimeException(e);
    }
  }

  public static String prettyPrint(Object obj) {
    try {
      return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj);
    } catch (JsonProcessingException e) {
      throw new JsonRuntimeException(e);
    }
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return mapper.readValue(json, clazz);
    } catch (JsonProcessingException e) {
      throw new JsonRuntimeException(e);
    }
  }

  public static <T> T fromJson(String json, TypeReference<T> type) {
    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new JsonRuntimeException(e);
    }
  }

  /**
   * Parses {@code json} into a tree. Unlike the other helpers this throws the checked exception, so
   * callers that classify malformed payloads can tell parse failures apart from other errors.
   */
  public static JsonNode readTree(String json) throws JsonProcessingException {
    return mapper.readTree(json);
  }
}
