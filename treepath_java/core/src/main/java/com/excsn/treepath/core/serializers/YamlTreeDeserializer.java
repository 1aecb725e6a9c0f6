package com.excsn.treepath.core.serializers;

import com.excsn.treepath.core.exceptions.TreeLoadException;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

public class YamlTreeDeserializer implements TreeDeserializer<String> {

  private final Yaml _yaml;

  public YamlTreeDeserializer() {
    _yaml = new Yaml();
  }

  @Override
  public Object deserialize(String data) {

    try {
      return _yaml.load(data);
    } catch (YAMLException e) {
      throw new TreeLoadException("Could not parse YAML document", e);
    }
  }
}
