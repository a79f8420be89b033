package edu.brandeis.cosi103a.lycans.stats;

import com.google.common.collect.ImmutableList;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * One-pass group-and-fold used by the reports: a key extractor picks the group of each item,
 * a per-group accumulator is created on first use and folded over the group's items, and a
 * finalizer turns each accumulator into an immutable result.
 *
 * <p>Accumulators live only for the duration of {@link #run}; nothing is kept between calls.
 * Results come back in first-seen key order.
 *
 * @param <T> input item type
 * @param <K> group key type
 * @param <A> mutable accumulator type
 * @param <R> result type
 */
public final class Aggregation<T, K, A, R> {

    private final Function<? super T, ? extends K> keyExtractor;
    private final Function<? super K, ? extends A> accumulatorFactory;
    private final BiConsumer<? super A, ? super T> folder;
    private final BiFunction<? super K, ? super A, ? extends R> finalizer;

    private Aggregation(Function<? super T, ? extends K> keyExtractor,
                        Function<? super K, ? extends A> accumulatorFactory,
                        BiConsumer<? super A, ? super T> folder,
                        BiFunction<? super K, ? super A, ? extends R> finalizer) {
        this.keyExtractor = keyExtractor;
        this.accumulatorFactory = accumulatorFactory;
        this.folder = folder;
        this.finalizer = finalizer;
    }

    /**
     * @param keyExtractor       group of an item, or null to skip the item
     * @param accumulatorFactory creates the accumulator of a new group
     * @param folder             folds one item into its group's accumulator
     * @param finalizer          converts a group's accumulator into a result
     */
    public static <T, K, A, R> Aggregation<T, K, A, R> of(
            Function<? super T, ? extends K> keyExtractor,
            Function<? super K, ? extends A> accumulatorFactory,
            BiConsumer<? super A, ? super T> folder,
            BiFunction<? super K, ? super A, ? extends R> finalizer) {
        return new Aggregation<>(keyExtractor, accumulatorFactory, folder, finalizer);
    }

    public ImmutableList<R> run(Iterable<? extends T> items) {
        Map<K, A> groups = new LinkedHashMap<>();
        for (T item : items) {
            K key = keyExtractor.apply(item);
            if (key == null) {
                continue;
            }
            A acc = groups.computeIfAbsent(key, accumulatorFactory::apply);
            folder.accept(acc, item);
        }
        ImmutableList.Builder<R> results = ImmutableList.builder();
        groups.forEach((key, acc) -> results.add(finalizer.apply(key, acc)));
        return results.build();
    }
}
