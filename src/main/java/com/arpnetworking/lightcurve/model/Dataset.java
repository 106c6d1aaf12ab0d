/*
 * Copyright 2026 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.lightcurve.model;

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A time ordered sequence of {@link Bin} instances that all share one
 * {@link Kind}. The kind is fixed at construction and every bin added later
 * must match it.
 *
 * <p>A dataset is owned by the caller and mutated in place by the mergers.
 * It is not thread safe; callers must not mutate the same dataset from more
 * than one thread at a time.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class Dataset {

    /**
     * Public constructor.
     *
     * @param name The name of the dataset, for example {@code PC} or {@code PCUL}.
     * @param kind The {@link Kind} of every bin in the dataset.
     * @param bins The bins, in ascending time order.
     * @throws IllegalArgumentException if a bin does not match the kind or the bins are out of order.
     */
    public Dataset(final String name, final Kind kind, final List<Bin> bins) {
        _name = name;
        _kind = kind;
        for (final Bin bin : bins) {
            checkKind(bin);
        }
        checkOrder(bins);
        _bins = Lists.newArrayList(bins);
    }

    /**
     * Create an empty dataset.
     *
     * @param name The name of the dataset.
     * @param kind The {@link Kind} of every bin in the dataset.
     * @return New empty {@link Dataset}.
     */
    public static Dataset empty(final String name, final Kind kind) {
        return new Dataset(name, kind, Collections.emptyList());
    }

    public String getName() {
        return _name;
    }

    public Kind getKind() {
        return _kind;
    }

    /**
     * A read-only view of the bins.
     *
     * @return The bins in ascending time order.
     */
    public List<Bin> getBins() {
        return Collections.unmodifiableList(_bins);
    }

    /**
     * Get one bin.
     *
     * @param index The row index.
     * @return The bin at that row.
     */
    public Bin getBin(final int index) {
        return _bins.get(index);
    }

    public int size() {
        return _bins.size();
    }

    /**
     * Get the selected bins, validating the selection against this dataset.
     *
     * @param selection The rows to select.
     * @return The selected bins in row order.
     * @throws InconsistentSelectionException if a selected row is not in this dataset.
     */
    public ImmutableList<Bin> select(final RowSelection selection) {
        selection.checkWithin(_name, _bins.size());
        final ImmutableList.Builder<Bin> selected = ImmutableList.builder();
        for (final int index : selection.getIndices()) {
            selected.add(_bins.get(index));
        }
        return selected.build();
    }

    /**
     * Add a bin at the position that keeps the dataset in ascending time order.
     * A bin with the same time as existing bins is placed after them.
     *
     * @param bin The bin to add.
     * @throws IllegalArgumentException if the bin does not match the kind of this dataset.
     */
    public void insert(final Bin bin) {
        update(Optional.empty(), Optional.of(bin));
    }

    /**
     * Remove the selected bins.
     *
     * @param selection The rows to remove.
     * @throws InconsistentSelectionException if a selected row is not in this dataset.
     */
    public void remove(final RowSelection selection) {
        update(Optional.of(selection), Optional.empty());
    }

    /**
     * Remove bins and add a bin as a single change. Every precondition is
     * checked before the dataset is touched, so on failure the dataset is left
     * exactly as it was.
     *
     * @param removal The rows to remove, if any.
     * @param insertion The bin to add after removal, if any.
     * @throws InconsistentSelectionException if a selected row is not in this dataset.
     * @throws IllegalArgumentException if the bin does not match the kind of this dataset.
     */
    public void update(final Optional<RowSelection> removal, final Optional<Bin> insertion) {
        if (removal.isPresent()) {
            removal.get().checkWithin(_name, _bins.size());
        }
        if (insertion.isPresent()) {
            checkKind(insertion.get());
        }

        final List<Bin> updated = Lists.newArrayListWithCapacity(_bins.size() + 1);
        for (int i = 0; i < _bins.size(); ++i) {
            if (!removal.isPresent() || !removal.get().contains(i)) {
                updated.add(_bins.get(i));
            }
        }
        if (insertion.isPresent()) {
            final Bin bin = insertion.get();
            int position = updated.size();
            while (position > 0 && updated.get(position - 1).getTime() > bin.getTime()) {
                --position;
            }
            updated.add(position, bin);
        }

        _bins.clear();
        _bins.addAll(updated);
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("name", _name)
                .put("kind", _kind)
                .put("size", _bins.size())
                .build();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Name", _name)
                .add("Kind", _kind)
                .add("Bins", _bins)
                .toString();
    }

    private void checkKind(final Bin bin) {
        Preconditions.checkArgument(
                bin.getKind() == _kind,
                "Invalid bin kind for dataset; dataset=%s, datasetKind=%s, binKind=%s, time=%s",
                _name,
                _kind,
                bin.getKind(),
                bin.getTime());
    }

    private void checkOrder(final List<Bin> bins) {
        for (int i = 1; i < bins.size(); ++i) {
            Preconditions.checkArgument(
                    bins.get(i - 1).getTime() <= bins.get(i).getTime(),
                    "Invalid bin order for dataset; dataset=%s, row=%s, time=%s, previousTime=%s",
                    _name,
                    i,
                    bins.get(i).getTime(),
                    bins.get(i - 1).getTime());
        }
    }

    private final String _name;
    private final Kind _kind;
    private final List<Bin> _bins;
}
