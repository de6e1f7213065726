package com.gentoro.fetchgate.endpoints;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.fetchgate.FetchGateSettings;
import com.gentoro.fetchgate.exception.ValidationException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes and validates a batch request body: a JSON array of 1..{@code maxIdentifiers} non-blank
 * strings, each at most {@code maxIdentifierLength} characters long.
 */
public final class BatchRequestParser {
  private final ObjectMapper mapper;
  private final FetchGateSettings settings;

  public BatchRequestParser(ObjectMapper mapper, FetchGateSettings settings) {
    this.mapper = mapper;
    this.settings = settings;
  }

  public long maxBodyBytes() {
    return settings.maxBodyBytes();
  }

  /** Read at most {@link #maxBodyBytes()} from {@code body} and validate it. */
  public List<String> parse(InputStream body) throws IOException {
    long limit = maxBodyBytes();
    byte[] bytes = body.readNBytes((int) Math.min(Integer.MAX_VALUE - 1, limit + 1));
    if (bytes.length > limit) {
      throw new RequestTooLargeException("Request body exceeds " + limit + " bytes");
    }
    return parse(bytes);
  }

  public List<String> parse(byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      throw new ValidationException("Request body is empty, expected a JSON array of URLs");
    }
    JsonNode root;
    try {
      root = mapper.readTree(bytes);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Request body is not valid JSON: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new ValidationException("Could not read request body", e);
    }
    if (root == null || !root.isArray()) {
      throw new ValidationException("Expected a JSON array of URLs");
    }
    if (root.size() > settings.maxIdentifiers()) {
      throw new ValidationException(
          "Too many URLs: "
              + root.size()
              + ", please send no more than "
              + settings.maxIdentifiers());
    }
    if (root.isEmpty()) {
      throw new ValidationException("Expected at least one URL");
    }

    List<String> identifiers = new ArrayList<>(root.size());
    for (int i = 0; i < root.size(); i++) {
      JsonNode item = root.get(i);
      if (!item.isTextual()) {
        throw new ValidationException("Entry " + i + " is not a string");
      }
      String identifier = item.asText();
      if (identifier.isBlank()) {
        throw new ValidationException("Entry " + i + " is blank");
      }
      if (identifier.length() > settings.maxIdentifierLength()) {
        throw new ValidationException(
            "Entry " + i + " exceeds " + settings.maxIdentifierLength() + " characters");
      }
      identifiers.add(identifier);
    }
    return identifiers;
  }
}
