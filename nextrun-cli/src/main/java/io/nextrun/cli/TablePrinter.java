package io.nextrun.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * Prints rows as left-aligned columns. Column widths are known only after every
 * row was added, so nothing is written before {@link #print()}.
 */
class TablePrinter
{
    private static final int MARGIN = 2;

    private final PrintStream out;
    private final List<List<String>> rows = new ArrayList<>();
    private final List<Integer> widths = new ArrayList<>();

    TablePrinter(PrintStream out)
    {
        this.out = out;
    }

    void row(String... columns)
    {
        List<String> row = ImmutableList.copyOf(columns);
        for (int i = 0; i < row.size(); i++) {
            int length = row.get(i).length();
            if (widths.size() <= i) {
                widths.add(length);
            }
            else if (widths.get(i) < length) {
                widths.set(i, length);
            }
        }
        rows.add(row);
    }

    void print()
    {
        for (List<String> row : rows) {
            StringBuilder line = new StringBuilder();
            for (int i = 0; i < row.size(); i++) {
                if (i + 1 < row.size()) {
                    line.append(Strings.padEnd(row.get(i), widths.get(i) + MARGIN, ' '));
                }
                else {
                    line.append(row.get(i));
                }
            }
            out.println(line);
        }
    }
}
