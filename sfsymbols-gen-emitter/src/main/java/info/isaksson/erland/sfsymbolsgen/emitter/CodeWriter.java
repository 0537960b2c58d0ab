package info.isaksson.erland.sfsymbolsgen.emitter;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a generated file line by line.
 *
 * <p>Every {@link #writeLine(String)} appends a new line indented to the current level, unless
 * {@link #nextLineAppendsToLastLine()} was called just before: then the text is concatenated onto the
 * last stored line without indentation. The flag is single-shot and reset by every write. This lets
 * independent render routines (a call's receiver, its arguments, its trailing closure) each write
 * their own fragment while still producing one contiguous output line.</p>
 */
final class CodeWriter {

    private static final String INDENT = "    ";

    private final List<String> lines = new ArrayList<>();
    private int level;
    private boolean nextWriteAppendsToLastLine;

    /** Stored lines joined with {@code \n}. */
    String rendered() {
        return String.join("\n", lines);
    }

    int level() {
        return level;
    }

    void writeLine(String line) {
        String newLine;
        if (nextWriteAppendsToLastLine && !lines.isEmpty()) {
            newLine = lines.remove(lines.size() - 1) + line;
        } else {
            newLine = INDENT.repeat(level) + line;
        }
        lines.add(newLine);
        nextWriteAppendsToLastLine = false;
    }

    void push() {
        level++;
    }

    void pop() {
        if (level <= 0) throw new IllegalStateException("Cannot pop below 0");
        level--;
    }

    /** Runs {@code work} one level deeper; the level is restored on every exit path. */
    void withNestedLevel(Runnable work) {
        push();
        try {
            work.run();
        } finally {
            pop();
        }
    }

    /** Safe to call repeatedly; reset by the next {@link #writeLine(String)}. */
    void nextLineAppendsToLastLine() {
        nextWriteAppendsToLastLine = true;
    }
}
