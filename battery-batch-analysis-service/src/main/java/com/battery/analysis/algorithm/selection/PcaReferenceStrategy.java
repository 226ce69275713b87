package com.battery.analysis.algorithm.selection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.IntStream;

import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.util.LocalizedFormats;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.battery.analysis.algorithm.util.RobustStatistics;
import com.battery.analysis.config.properties.PcaProperties;
import com.battery.analysis.dto.DiagnosticKind;
import com.battery.analysis.dto.MetricName;
import com.battery.analysis.dto.ReferenceSelection;

/**
 * Selects the channel closest to the centroid of the candidates in principal component space.
 *
 * <p>The configured features are standardised, the covariance matrix of the standardised data is
 * eigendecomposed and the data is projected onto the leading {@code nComponents} eigenvectors.
 * Missing feature values are filled with the feature median; features nobody reports are dropped.
 * Channels farther from the centroid than {@code mean + outlierSigma·sd} of all distances are
 * named as distant in the rationale but are not excluded.
 *
 * <p>Preconditions: PCA enabled, at least {@code minChannels} candidates and two usable features.
 * Numerical failures of the decomposition, and a feature set without any variance, count as unmet
 * preconditions.
 */
@Component
public class PcaReferenceStrategy implements ReferenceChannelStrategy {

  private static final Logger logger = LoggerFactory.getLogger(PcaReferenceStrategy.class);

  private static final int MIN_FEATURES = 2;

  /** Standard deviations below this are treated as a constant feature. */
  private static final double MIN_FEATURE_SPREAD = 1e-12;

  /** Result of projecting the candidates; package-private for tests. */
  record Projection(double[] distances, double explainedVariance, int components) {}

  @Override
  public Optional<ReferenceSelection> select(ReferenceSelectionContext context) {
    PcaProperties properties = context.settings().pca();
    if (!properties.enabled()) {
      context.report(DiagnosticKind.STRATEGY_SKIPPED, "PCA selection disabled");
      return Optional.empty();
    }
    if (context.size() < properties.minChannels()) {
      context.report(
          DiagnosticKind.STRATEGY_SKIPPED,
          "PCA selection needs %d channels, %d available",
          properties.minChannels(),
          context.size());
      return Optional.empty();
    }

    List<String> ids = context.channelIds();
    List<MetricName> features = new ArrayList<>();
    List<double[]> columns = new ArrayList<>();
    for (MetricName feature : properties.features()) {
      double[] column = featureColumn(context, ids, feature);
      if (column != null) {
        features.add(feature);
        columns.add(column);
      }
    }
    if (features.size() < MIN_FEATURES) {
      context.report(
          DiagnosticKind.STRATEGY_SKIPPED,
          "PCA selection needs %d features, %d available",
          MIN_FEATURES,
          features.size());
      return Optional.empty();
    }

    Projection projection;
    try {
      projection = project(standardise(columns, ids.size()), properties.nComponents());
    } catch (MathIllegalArgumentException | MathIllegalStateException | MathArithmeticException e) {
      logger.warn(
          "PCA failed for batch {}: {}", context.candidates().batchKey(), e.getMessage());
      context.report(DiagnosticKind.NUMERICAL_FAILURE, "PCA failed: %s", e.getMessage());
      return Optional.empty();
    }

    double[] distances = projection.distances();
    int best = 0;
    for (int i = 1; i < distances.length; i++) {
      if (distances[i] < distances[best]) {
        best = i;
      }
    }

    List<String> distant = distantChannels(ids, distances, properties.outlierSigma());
    String rationale =
        String.format(
            "Closest to centroid of %d components over %s (explained variance %.1f%%)%s",
            projection.components(),
            features,
            projection.explainedVariance() * 100.0,
            distant.isEmpty() ? "" : ", distant channels " + distant);
    logger.debug(
        "PCA distances for batch {}: {}", context.candidates().batchKey(), Arrays.toString(distances));
    return Optional.of(new ReferenceSelection(ids.get(best), getMethod(), distances[best], rationale));
  }

  private static double[] featureColumn(
      ReferenceSelectionContext context, List<String> ids, MetricName feature) {
    double[] column = new double[ids.size()];
    List<Double> present = new ArrayList<>();
    boolean[] missing = new boolean[ids.size()];
    for (int i = 0; i < ids.size(); i++) {
      OptionalDouble value = context.metricsOf(ids.get(i)).value(feature);
      if (value.isPresent()) {
        column[i] = value.getAsDouble();
        present.add(column[i]);
      } else {
        missing[i] = true;
      }
    }
    if (present.isEmpty()) {
      return null;
    }
    double fill = RobustStatistics.median(present.stream().mapToDouble(Double::doubleValue).toArray());
    for (int i = 0; i < column.length; i++) {
      if (missing[i]) {
        column[i] = fill;
      }
    }
    return column;
  }

  /**
   * Z-scores every feature column into a samples-by-features matrix.
   *
   * @throws MathIllegalStateException if no feature varies across the samples
   */
  static double[][] standardise(List<double[]> columns, int samples) {
    double[][] data = new double[samples][columns.size()];
    StandardDeviation standardDeviation = new StandardDeviation();
    boolean anyVariance = false;
    for (int f = 0; f < columns.size(); f++) {
      double[] column = columns.get(f);
      double mean = RobustStatistics.mean(column);
      double sd = standardDeviation.evaluate(column);
      if (sd < MIN_FEATURE_SPREAD) {
        continue;
      }
      anyVariance = true;
      for (int i = 0; i < samples; i++) {
        data[i][f] = (column[i] - mean) / sd;
      }
    }
    if (!anyVariance) {
      throw new MathIllegalStateException(
          LocalizedFormats.SIMPLE_MESSAGE, "no PCA feature varies across channels");
    }
    return data;
  }

  /** Projects the standardised data and measures each sample's distance to the centroid. */
  static Projection project(double[][] data, int requestedComponents) {
    RealMatrix matrix = new Array2DRowRealMatrix(data, false);
    RealMatrix covariance = new Covariance(matrix).getCovarianceMatrix();
    EigenDecomposition decomposition = new EigenDecomposition(covariance);
    double[] eigenvalues = decomposition.getRealEigenvalues();

    Integer[] order =
        IntStream.range(0, eigenvalues.length).boxed().toArray(Integer[]::new);
    Arrays.sort(order, Comparator.comparingDouble((Integer i) -> eigenvalues[i]).reversed());

    int components = Math.min(requestedComponents, eigenvalues.length);
    double total = 0.0;
    for (double eigenvalue : eigenvalues) {
      total += Math.max(eigenvalue, 0.0);
    }
    if (total <= 0.0) {
      throw new MathArithmeticException(
          LocalizedFormats.SIMPLE_MESSAGE, "covariance matrix has no positive eigenvalue");
    }
    double explained = 0.0;
    RealMatrix basis = new Array2DRowRealMatrix(eigenvalues.length, components);
    for (int c = 0; c < components; c++) {
      basis.setColumnVector(c, decomposition.getEigenvector(order[c]));
      explained += Math.max(eigenvalues[order[c]], 0.0);
    }

    RealMatrix projected = matrix.multiply(basis);
    int samples = projected.getRowDimension();
    double[] centroid = new double[components];
    for (int c = 0; c < components; c++) {
      centroid[c] = RobustStatistics.mean(projected.getColumn(c));
    }
    double[] distances = new double[samples];
    for (int i = 0; i < samples; i++) {
      double sum = 0.0;
      for (int c = 0; c < components; c++) {
        double diff = projected.getEntry(i, c) - centroid[c];
        sum += diff * diff;
      }
      distances[i] = Math.sqrt(sum);
    }
    return new Projection(distances, explained / total, components);
  }

  private static List<String> distantChannels(List<String> ids, double[] distances, double sigma) {
    if (distances.length < 2) {
      return List.of();
    }
    double mean = RobustStatistics.mean(distances);
    double sd = new StandardDeviation().evaluate(distances);
    List<String> distant = new ArrayList<>();
    for (int i = 0; i < distances.length; i++) {
      if (distances[i] > mean + sigma * sd) {
        distant.add(ids.get(i));
      }
    }
    return distant;
  }

  @Override
  public ReferenceMethod getMethod() {
    return ReferenceMethod.PCA;
  }
}
