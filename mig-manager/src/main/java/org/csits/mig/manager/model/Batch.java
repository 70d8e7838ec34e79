package org.csits.mig.manager.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 批：一次加载器调用处理的有序行集合，不可变。
 */
@ToString
@EqualsAndHashCode
public final class Batch implements Iterable<Row> {

    private static final Batch EMPTY = new Batch(Collections.emptyList());

    private final List<Row> rows;

    private Batch(List<Row> rows) {
        this.rows = rows;
    }

    public static Batch of(List<Row> rows) {
        if (rows == null || rows.isEmpty()) {
            return EMPTY;
        }
        return new Batch(Collections.unmodifiableList(new ArrayList<>(rows)));
    }

    public static Batch of(Row... rows) {
        List<Row> list = new ArrayList<>(rows.length);
        Collections.addAll(list, rows);
        return of(list);
    }

    public static Batch empty() {
        return EMPTY;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * 按唯一标识替换行，未出现在 replacements 中的行保持原样。
     */
    public Batch replace(Map<String, Row> replacements) {
        if (replacements == null || replacements.isEmpty()) {
            return this;
        }
        List<Row> result = new ArrayList<>(rows.size());
        for (Row row : rows) {
            Row replacement = replacements.get(row.uid());
            result.add(replacement != null ? replacement : row);
        }
        return new Batch(Collections.unmodifiableList(result));
    }

    public Batch append(Batch other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<Row> result = new ArrayList<>(rows.size() + other.size());
        result.addAll(rows);
        result.addAll(other.rows);
        return new Batch(Collections.unmodifiableList(result));
    }

    /**
     * 按批大小切分，用于加载阶段逐批拉取。
     */
    public List<Batch> split(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize 必须大于 0: " + batchSize);
        }
        List<Batch> chunks = new ArrayList<>();
        for (int from = 0; from < rows.size(); from += batchSize) {
            int to = Math.min(rows.size(), from + batchSize);
            chunks.add(new Batch(rows.subList(from, to)));
        }
        return chunks;
    }

    @Override
    public Iterator<Row> iterator() {
        return rows.iterator();
    }
}
