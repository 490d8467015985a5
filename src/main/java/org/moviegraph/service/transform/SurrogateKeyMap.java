package org.moviegraph.service.transform;

import java.util.Optional;

/**
 * Natural id to surrogate id lookup of one resolved entity table.
 */
public interface SurrogateKeyMap {

    String entityTable();

    Optional<Object> surrogateOf(Object naturalId);
}
