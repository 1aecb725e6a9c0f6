package com.excsn.treepath.core.serializers;

import com.excsn.treepath.core.exceptions.TreeLoadException;

/**
 * Turns a document into a tree of insertion ordered {@link java.util.Map}s, {@link java.util.List}s and scalars.
 */
public interface TreeDeserializer<Input> {

  /**
   * @throws TreeLoadException if the document is malformed
   */
  Object deserialize(Input data);
}
