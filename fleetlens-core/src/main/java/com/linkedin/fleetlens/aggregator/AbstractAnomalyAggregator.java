/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.aggregator;

import com.linkedin.fleetlens.exception.IdentityMismatchException;
import com.linkedin.fleetlens.exception.InsufficientDataException;
import com.linkedin.fleetlens.model.AggregatedAnomalyScore;
import com.linkedin.fleetlens.model.Entity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;


/**
 * The base class of the aggregators of one hierarchy level. An aggregator combines the scores of the entities one
 * level down into the score of their common parent entity.
 * <p>
 * Every aggregation requires a non-empty input list whose inputs all belong to the same parent. Mixing parents is
 * rejected so that scores of different tenants are never blended.
 *
 * @param <I> The input type.
 * @param <E> The parent entity the inputs are combined for.
 * @param <S> The aggregated score type.
 */
public abstract class AbstractAnomalyAggregator<I, E extends Entity<?>, S extends AggregatedAnomalyScore<E>> {
  private static final Logger LOG = LoggerFactory.getLogger(AbstractAnomalyAggregator.class);
  protected final AggregationStrategy _strategy;

  protected AbstractAnomalyAggregator(AggregationStrategy strategy) {
    _strategy = validateNotNull(strategy, "Aggregation strategy cannot be null.");
  }

  public AggregationStrategy strategy() {
    return _strategy;
  }

  /**
   * Combine the given inputs into the score of their parent entity, stamped with the current time.
   *
   * @param inputs The inputs of one parent entity.
   * @return The aggregated score.
   * @throws InsufficientDataException If there is no input.
   * @throws IdentityMismatchException If the inputs do not all belong to the same parent entity.
   */
  public S aggregate(List<I> inputs) throws InsufficientDataException, IdentityMismatchException {
    return aggregate(inputs, System.currentTimeMillis());
  }

  /**
   * Combine the given inputs into the score of their parent entity.
   *
   * @param inputs The inputs of one parent entity.
   * @param timestampMs The time of the aggregation in epoch milliseconds.
   * @return The aggregated score.
   * @throws InsufficientDataException If there is no input.
   * @throws IdentityMismatchException If the inputs do not all belong to the same parent entity.
   */
  public S aggregate(List<I> inputs, long timestampMs) throws InsufficientDataException, IdentityMismatchException {
    if (inputs == null || inputs.isEmpty()) {
      throw new InsufficientDataException(String.format("Cannot aggregate %s scores without any input.", level()));
    }
    E parent = parentOf(inputs.get(0));
    for (I input : inputs) {
      E other = parentOf(input);
      if (!parent.equals(other)) {
        throw new IdentityMismatchException(String.format("Cannot aggregate inputs of %s and %s into one %s score.",
                                                          parent, other, level()));
      }
    }
    double score = clamp(combine(inputs));
    S aggregated = newScore(parent, score, inputs.size(), numAnomalies(inputs), timestampMs);
    LOG.trace("Aggregated {} inputs into {}.", inputs.size(), aggregated);
    return aggregated;
  }

  /**
   * @return The hierarchy level of the produced scores.
   */
  protected abstract String level();

  /**
   * @param input An input.
   * @return The parent entity of the given input.
   */
  protected abstract E parentOf(I input);

  /**
   * @param inputs The inputs of one parent, non-empty.
   * @return The combined score of the inputs according to the strategy.
   */
  protected abstract double combine(List<I> inputs);

  protected abstract int numAnomalies(List<I> inputs);

  protected abstract S newScore(E parent, double score, int numMetricsAnalyzed, int numAnomaliesDetected,
                                long timestampMs);

  /**
   * Combine scores that do not carry per-input weights. {@link AggregationStrategy#WEIGHTED} falls back to
   * {@link AggregationStrategy#MAX}.
   *
   * @param scores The scores, non-empty.
   * @return The combined score.
   */
  protected double combineUnweighted(double[] scores) {
    switch (_strategy) {
      case MEAN:
        return AggregationFunctions.mean(scores);
      case P95:
        return AggregationFunctions.percentile(scores, AggregationFunctions.P95);
      case MAX:
      case WEIGHTED:
        return AggregationFunctions.max(scores);
      default:
        throw new IllegalStateException("Unsupported aggregation strategy " + _strategy);
    }
  }

  /**
   * Sort the given scores by aggregate score, highest first. Scores with equal aggregate scores keep their order.
   *
   * @param scores The scores to rank.
   * @param topN The number of scores to keep, {@code null} or non-positive to keep all of them.
   * @param <T> The score type.
   * @return A new list with the ranked scores.
   */
  protected static <T extends AggregatedAnomalyScore<?>> List<T> rank(List<T> scores, Integer topN) {
    List<T> ranked = new ArrayList<>(validateNotNull(scores, "Scores cannot be null."));
    ranked.sort(Comparator.comparingDouble((T score) -> score.aggregateScore()).reversed());
    if (topN != null && topN > 0 && topN < ranked.size()) {
      return new ArrayList<>(ranked.subList(0, topN));
    }
    return ranked;
  }

  // Weighted sums may drift out of [0, 1] by a rounding error.
  private static double clamp(double score) {
    return Math.max(0.0, Math.min(1.0, score));
  }
}
