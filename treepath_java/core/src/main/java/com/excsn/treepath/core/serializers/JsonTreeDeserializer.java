package com.excsn.treepath.core.serializers;

import com.excsn.treepath.core.exceptions.TreeLoadException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

public class JsonTreeDeserializer implements TreeDeserializer<String> {

  private final ObjectMapper _objectMapper;

  public JsonTreeDeserializer(ObjectMapper objectMapper) {
    _objectMapper = objectMapper;
  }

  public static JsonTreeDeserializer create() {

    var objectMapper = new ObjectMapper();

    return new JsonTreeDeserializer(objectMapper);
  }

  @Override
  public Object deserialize(String data) {

    try {
      return _objectMapper.readValue(data, Object.class);
    } catch (JsonProcessingException e) {
      throw new TreeLoadException("Could not parse JSON document", e);
    }
  }
}
