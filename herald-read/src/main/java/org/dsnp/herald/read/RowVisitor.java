package org.dsnp.herald.read;

import org.dsnp.herald.row.BatchRow;

@FunctionalInterface
public interface RowVisitor {
  void visit(BatchRow row);
}
