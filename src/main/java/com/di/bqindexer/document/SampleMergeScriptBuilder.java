package com.di.bqindexer.document;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns rows of a sample table into {@link SampleMergeUpdate}s.
 *
 * <p>A plain partial update cannot be used for samples: the {@code samples}
 * field is an array, and a partial update replaces the whole array. After a
 * {@code center} table and then a {@code platform} table, every sample would
 * have lost its center. The update is instead run as a script that finds the
 * element with the same sample id and merges into it (see {@link SampleMerger}).
 *
 * <p>Columns are scoped as {@code <table>.<column>}, except the sample-id column,
 * which is the join key and stays bare.
 */
@Slf4j
public class SampleMergeScriptBuilder {

    /**
     * Painless form of {@link SampleMerger#merge}, maintained by hand alongside it.
     * {@code params.key} names the join-key field, {@code params.sample} carries
     * the fields to merge.
     */
    public static final String MERGE_SAMPLE_SCRIPT = """
            if (ctx._source.samples == null) {
              ctx._source.samples = [new HashMap(params.sample)];
            } else {
              Map target = null;
              Iterator it = ctx._source.samples.iterator();
              while (it.hasNext()) {
                Map existing = (Map) it.next();
                if (params.sample.get(params.key).equals(existing.get(params.key))) {
                  if (target == null) {
                    target = existing;
                  } else {
                    target.putAll(existing);
                    it.remove();
                  }
                }
              }
              if (target == null) {
                ctx._source.samples.add(new HashMap(params.sample));
              } else {
                target.putAll(params.sample);
              }
            }
            """;

    public static final String HAS_FILE_PREFIX = "_has_";

    private final String              tableName;
    private final String              participantIdColumn;
    private final String              sampleIdColumn;
    private final Map<String, String> sampleFileColumns;

    /**
     * @param sampleFileColumns file type label → fully scoped column, e.g.
     *                          {@code "Chr 18 VCF" → "proj.ds.samples.chr_18_vcf"}
     */
    public SampleMergeScriptBuilder(String tableName,
                                    String participantIdColumn,
                                    String sampleIdColumn,
                                    Map<String, String> sampleFileColumns) {
        this.tableName           = tableName;
        this.participantIdColumn = participantIdColumn;
        this.sampleIdColumn      = sampleIdColumn;
        this.sampleFileColumns   = sampleFileColumns == null ? Map.of() : sampleFileColumns;
    }

    /**
     * Builds the merge for one row; empty when the row has no participant or
     * sample id.
     */
    public Optional<SampleMergeUpdate> build(Map<String, Object> row) {
        Map<String, Object> values = RowValues.dropNulls(row);
        String participantId = RowValues.idOf(values.remove(participantIdColumn));
        if (participantId == null || !values.containsKey(sampleIdColumn)) {
            log.warn("[INDEX] {}: skipping row without {} or {}", tableName, participantIdColumn, sampleIdColumn);
            return Optional.empty();
        }

        Map<String, Object> sample = new LinkedHashMap<>();
        values.forEach((column, value) ->
                sample.put(column.equals(sampleIdColumn) ? column : tableName + "." + column, value));

        // Flags are only (re)computed by the table that owns the file column.
        sampleFileColumns.forEach((fileType, column) -> {
            if (column.startsWith(tableName + ".")) {
                sample.put(hasFileField(fileType), RowValues.isTruthy(sample.get(column)));
            }
        });

        return Optional.of(new SampleMergeUpdate(participantId, sampleIdColumn, sample));
    }

    /** {@code "Chr 18 VCF"} → {@code _has_chr_18_vcf}. */
    public static String hasFileField(String fileType) {
        return HAS_FILE_PREFIX + fileType.toLowerCase().replace(" ", "_");
    }
}
