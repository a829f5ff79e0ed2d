package org.dxworks.markflow.html;

import java.util.List;

/**
 * Receiver of the token stream produced by a tokenizer.
 */
public interface TokenSink {

    void open(String name, List<RawAttribute> attributes, boolean selfClosing);

    void close(String name);

    void text(String text);

    void end();

    default void parseError(String message) {
    }
}
