package co.fanki.tracegraph.shared;

import java.io.Serializable;

/**
 * Marker for immutable values compared by their attributes, such as
 * {@code Link}.
 *
 * <p>Implementations validate in their constructor and override
 * {@code equals} and {@code hashCode} over every attribute.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
