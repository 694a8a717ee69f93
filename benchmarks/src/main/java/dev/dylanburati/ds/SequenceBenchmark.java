package dev.dylanburati.ds;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Random;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

@State(Scope.Benchmark)
public class SequenceBenchmark {
  private static final int OPS = 10_000_000;

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void slidingWindowDeque(Blackhole bh) {
    Deque<Integer> d = new Deque<>();
    long sum = 0;
    for (int i = 0; i < OPS; i++) {
      d.push(i);
      if (d.size() > 1000) {
        sum += d.shift();
      }
    }
    bh.consume(sum);
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void slidingWindowArrayDeque(Blackhole bh) {
    ArrayDeque<Integer> d = new ArrayDeque<>();
    long sum = 0;
    for (int i = 0; i < OPS; i++) {
      d.addLast(i);
      if (d.size() > 1000) {
        sum += d.pollFirst();
      }
    }
    bh.consume(sum);
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void randomInsertVector(Blackhole bh) {
    Vector<Integer> v = new Vector<>();
    Random r = new Random(0L);
    for (int i = 0; i < OPS / 100; i++) {
      v.insert(r.nextInt(v.size() + 1), i);
    }
    bh.consume(v.sum());
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void randomInsertArrayList(Blackhole bh) {
    ArrayList<Integer> v = new ArrayList<>();
    Random r = new Random(0L);
    for (int i = 0; i < OPS / 100; i++) {
      v.add(r.nextInt(v.size() + 1), i);
    }
    bh.consume(v.size());
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void randomInsertObjectArrayList(Blackhole bh) {
    ObjectArrayList<Integer> v = new ObjectArrayList<>();
    Random r = new Random(0L);
    for (int i = 0; i < OPS / 100; i++) {
      v.add(r.nextInt(v.size() + 1), i);
    }
    bh.consume(v.size());
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void priorityQueue(Blackhole bh) {
    PriorityQueue<Integer> pq = new PriorityQueue<>();
    Random r = new Random(0L);
    long sum = 0;
    for (int i = 0; i < OPS; i++) {
      pq.push(i, r.nextInt(1000));
      if (pq.size() > 1000) {
        sum += pq.pop();
      }
    }
    bh.consume(sum);
  }
}
