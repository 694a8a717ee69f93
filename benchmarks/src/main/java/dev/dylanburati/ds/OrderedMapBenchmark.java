package dev.dylanburati.ds;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.function.Consumer;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;

@State(Scope.Benchmark)
public class OrderedMapBenchmark {
  private static final int WORDS = 10_000_000;

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountOrderedMap(Blackhole bh) {
    OrderedMap<String, Integer> m = new OrderedMap<>();
    wordcountSimulated(word -> m.put(word, m.get(word, 0) + 1));
    System.out.println("Size: " + m.size());
    bh.consume(m);
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountOrderedMapView(Blackhole bh) {
    OrderedMap<String, Integer> m = new OrderedMap<>();
    Map<String, Integer> view = m.asJavaMap();
    wordcountSimulated(word -> view.merge(word, 1, (v1, v2) -> v1 + v2));
    System.out.println("Size: " + m.size());
    bh.consume(m);
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountLinkedHashMap(Blackhole bh) {
    LinkedHashMap<String, Integer> m = new LinkedHashMap<>();
    wordcountSimulated(word -> m.merge(word, 1, (v1, v2) -> v1 + v2));
    System.out.println("Size: " + m.size());
    bh.consume(m);
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountObject2IntLinkedMap(Blackhole bh) {
    Object2IntLinkedOpenHashMap<String> m = new Object2IntLinkedOpenHashMap<>();
    wordcountSimulated(word -> m.addTo(word, 1));
    System.out.println("Size: " + m.size());
    bh.consume(m);
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void insertRemoveOrderedMap(Blackhole bh) {
    OrderedMap<Integer, Integer> m = new OrderedMap<>();
    Random r = new Random(0L);
    for (int i = 0; i < WORDS; i++) {
      int k = r.nextInt(1 << 16);
      if (m.remove(k, null) == null) {
        m.put(k, i);
      }
    }
    bh.consume(m.size());
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void insertRemoveLinkedHashMap(Blackhole bh) {
    LinkedHashMap<Integer, Integer> m = new LinkedHashMap<>();
    Random r = new Random(0L);
    for (int i = 0; i < WORDS; i++) {
      int k = r.nextInt(1 << 16);
      if (m.remove(k) == null) {
        m.put(k, i);
      }
    }
    bh.consume(m.size());
  }

  private static int genWordId(double uniform) {
    // Prob of returning x is proportional to (x+3.7) ** -1.01
    // Similar distribution to English
    // x + 3.7 = (-0.01 * const * cdf + (3.7) ** -0.01) ** -100, with max x of 2**27
    return (int) Math.pow(-0.01 * 15.768233989819334 * uniform + 0.9870018865063785, -100.0);
  }

  private static final double[] LENGTH_CDF = new double[]{
    2.55402880e-15, 3.73483535e-07, 2.06251620e-04, 4.60037401e-03,
    2.77018313e-02, 8.59221455e-02, 1.82026193e-01, 3.04121079e-01,
    4.34720260e-01, 5.58784740e-01, 6.67021855e-01, 7.55676596e-01,
    8.24886736e-01, 8.76934270e-01, 9.14931000e-01, 9.42014131e-01,
    9.60943967e-01, 9.73962076e-01, 9.82793792e-01, 9.88716864e-01,
    9.92650419e-01, 9.95240748e-01, 9.96934095e-01, 9.98034022e-01,
    9.98744497e-01, 9.99201152e-01, 9.99493382e-01, 9.99679661e-01,
    9.99797989e-01, 9.99872918e-01, 9.99920231e-01, 9.99950030e-01
  };

  private static int genWordLen(double uniform) {
    int i = Arrays.binarySearch(LENGTH_CDF, uniform);
    return i >= 0 ? i : -i - 1;
  }

  private static void wordcountSimulated(Consumer<String> counter) {
    byte[] alph = "pfscxkde".getBytes(StandardCharsets.US_ASCII);
    byte[] wbuf = new byte[32];
    Random r = new Random(0L);
    for (int i = 0; i < WORDS; i++) {
      double uniform = r.nextDouble();
      int wlen = genWordLen(uniform);
      for (int wid = genWordId(uniform), j = 0; j < wlen; j++) {
        wbuf[j] = alph[(wid >> (3 * (j%9))) & 7];
      }
      counter.accept(new String(wbuf, 0, wlen, StandardCharsets.US_ASCII));
    }
  }
}
