module com.excsn.treepath.core {
  requires com.fasterxml.jackson.core;
  requires com.fasterxml.jackson.databind;
  requires com.google.common;
  requires alphanumeric.comparator;
  requires org.yaml.snakeyaml;

  exports com.excsn.treepath.core;
  exports com.excsn.treepath.core.exceptions;
  exports com.excsn.treepath.core.telemetry;
  exports com.excsn.treepath.core.serializers;
}
