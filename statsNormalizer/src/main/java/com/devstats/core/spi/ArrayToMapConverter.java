package com.devstats.core.spi;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

public interface ArrayToMapConverter {
  /**
   * Pivota la secuencia a un mapa usando el campo {@code keyName} de cada elemento.
   * Vacío si la secuencia no tiene forma pivotable (el llamador decide qué hacer).
   */
  Optional<ObjectNode> convert(ArrayNode sequence, String keyName, String keyPrefix);
}
