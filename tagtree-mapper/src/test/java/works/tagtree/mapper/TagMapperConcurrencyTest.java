package works.tagtree.mapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import works.tagtree.annotations.TagProperty;
import works.tagtree.tags.CompoundTag;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Types in this class are used nowhere else,
 * so the first operations on them populate every cache concurrently.
 */
class TagMapperConcurrencyTest {
	static final int THREADS = 8;
	static final int TASKS = 64;

	@Test
	void concurrentOperations_onColdCaches() throws Exception {
		TagMapper mapper = TagMapper.withDefaults();
		ExecutorService executor = Executors.newFixedThreadPool(THREADS);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<Expedition>> futures = new ArrayList<>();
		try {
			for (int i = 0; i < TASKS; i++) {
				int seed = i;
				futures.add(executor.submit(() -> {
					start.await();
					CompoundTag tag = mapper.serializeObject(Expedition.of(seed));
					if (seed % 2 == 0) {
						return mapper.deserializeObject(Expedition.class, tag);
					} else {
						Expedition existing = new Expedition();
						mapper.fillObject(existing, tag);
						return existing;
					}
				}));
			}
			start.countDown();
			for (int i = 0; i < TASKS; i++) {
				assertEquals(Expedition.of(i), futures.get(i).get(30, SECONDS));
			}
		} finally {
			executor.shutdown();
			assertTrue(executor.awaitTermination(30, SECONDS));
		}
	}

	@Test
	void concurrentOperations_distinctMappers_shareTypeDescriptors() throws Exception {
		ExecutorService executor = Executors.newFixedThreadPool(THREADS);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<Waypoint>> futures = new ArrayList<>();
		try {
			for (int i = 0; i < TASKS; i++) {
				int seed = i;
				futures.add(executor.submit(() -> {
					start.await();
					TagMapper mapper = TagMapper.withDefaults();
					return mapper.deserializeObject(Waypoint.class, mapper.serializeObject(new Waypoint("w" + seed, seed)));
				}));
			}
			start.countDown();
			for (int i = 0; i < TASKS; i++) {
				assertEquals(new Waypoint("w" + i, i), futures.get(i).get(30, SECONDS));
			}
		} finally {
			executor.shutdown();
			assertTrue(executor.awaitTermination(30, SECONDS));
		}
	}

	record Waypoint(@TagProperty String name, @TagProperty int altitude) { }

	static class Expedition {
		@TagProperty String leader;
		@TagProperty final List<Waypoint> route = new ArrayList<>();
		@TagProperty Map<String, Waypoint> camps = new LinkedHashMap<>();
		@TagProperty SortedSet<String> supplies;

		static Expedition of(int seed) {
			Expedition result = new Expedition();
			result.leader = "leader" + seed;
			for (int i = 0; i <= seed % 3; i++) {
				result.route.add(new Waypoint("stop" + i, seed * 10 + i));
			}
			result.camps.put("base", new Waypoint("base", seed));
			result.supplies = new TreeSet<>(List.of("rope", "tent" + seed));
			return result;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Expedition other)) {
				return false;
			}
			return Objects.equals(leader, other.leader)
				&& route.equals(other.route)
				&& Objects.equals(camps, other.camps)
				&& Objects.equals(supplies, other.supplies);
		}

		@Override
		public int hashCode() {
			return Objects.hash(leader, route, camps, supplies);
		}

		@Override
		public String toString() {
			return "Expedition{" + leader + ", " + route + ", " + camps + ", " + supplies + "}";
		}
	}
}
