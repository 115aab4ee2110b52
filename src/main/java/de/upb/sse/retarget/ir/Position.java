package de.upb.sse.retarget.ir;

import lombok.Value;

/**
 * Source position of a declaration or expression, used for diagnostics only.
 */
@Value
public class Position {
    public static final Position NONE = new Position("<unknown>", -1, -1);

    String file;
    int line;
    int column;

    @Override
    public String toString() {
        if (line < 0) return file;
        return file + ":" + line + ":" + column;
    }
}
