package org.dxworks.fortranframe.parser;

import org.dxworks.fortranframe.model.Origin;

/**
 * Early rule consulted before the classification table. Used to silently discard
 * recognized constructs that should not become nodes.
 */
@FunctionalInterface
public interface StatementInterceptor {

    /**
     * @return true when the statement is consumed and must produce no node
     */
    boolean intercept(String text, Origin origin);
}
