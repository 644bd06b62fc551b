package spmwis.solver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Recovers a concrete vertex set from a filled {@link MwisTable}.
 *
 * <p>Walking down from the root: a vertex whose parent was taken must be left out; any other
 * vertex follows its recorded best branch. Taken vertices force their children out, and left-out
 * vertices let each child pick independently. The set is therefore independent and its weight is
 * exactly {@link MwisTable#optimum()}.
 */
public final class MwisBacktracker {

  /** Selected vertex ids in ascending order. */
  public List<Integer> reconstruct(MwisTable table) {
    Objects.requireNonNull(table, "table");
    List<Integer> selected = new ArrayList<>();
    Deque<int[]> stack = new ArrayDeque<>();
    stack.push(new int[] {table.root(), 0});

    while (!stack.isEmpty()) {
      int[] entry = stack.pop();
      int v = entry[0];
      boolean parentTaken = entry[1] == 1;
      boolean take = !parentTaken && table.choice(v, Branch.INCLUDE);
      if (take) {
        selected.add(v);
      }
      for (int i = table.childCount(v) - 1; i >= 0; i--) {
        stack.push(new int[] {table.child(v, i), take ? 1 : 0});
      }
    }

    Collections.sort(selected);
    return Collections.unmodifiableList(selected);
  }
}
