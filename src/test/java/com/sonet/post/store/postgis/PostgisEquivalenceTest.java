package com.sonet.post.store.postgis;

import com.sonet.geo.GeoMath;
import com.sonet.geo.GeoPoint;
import com.sonet.post.mapper.PostMapper;
import com.sonet.post.model.Post;
import com.sonet.post.store.PageWindow;
import com.sonet.post.store.PostStore;
import com.sonet.post.store.sqlite.SqlitePostStore;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Runs the PostGIS store against a real database and checks that it returns exactly what the
 * bounding-box store returns for the same rows. Uses the empty PostGIS database named by
 * SONET_POSTGIS_URL when set (user and password default to sonet/sonet), otherwise a
 * throwaway postgis/postgis container; skipped when neither is available.
 */
@SpringBootTest
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@EnabledIf("postgisAvailable")
class PostgisEquivalenceTest {

    private static final String URL_ENV = "SONET_POSTGIS_URL";
    private static final DockerImageName POSTGIS_IMAGE = DockerImageName.parse("postgis/postgis:16-3.4")
            .asCompatibleSubstituteFor("postgres");

    private static PostgreSQLContainer<?> container;

    static boolean postgisAvailable() {
        return externalUrl() != null || DockerClientFactory.instance().isDockerAvailable();
    }

    @DynamicPropertySource
    static void postgres(DynamicPropertyRegistry registry) {
        String url = externalUrl();
        if (url != null) {
            registry.add("spring.datasource.url", () -> url);
            registry.add("spring.datasource.username", () -> envOr("SONET_POSTGIS_USER", "sonet"));
            registry.add("spring.datasource.password", () -> envOr("SONET_POSTGIS_PASSWORD", "sonet"));
        } else {
            container = new PostgreSQLContainer<>(POSTGIS_IMAGE);
            container.start();
            registry.add("spring.datasource.url", container::getJdbcUrl);
            registry.add("spring.datasource.username", container::getUsername);
            registry.add("spring.datasource.password", container::getPassword);
        }
        registry.add("sonet.storage.adapter", () -> "postgres");
    }

    @AfterAll
    static void stopContainer() {
        if (container != null) {
            container.stop();
        }
    }

    private static final GeoPoint CENTER = new GeoPoint(37.7749, -122.4194);

    @Autowired
    private PostStore postStore;

    private final String run = Long.toString(System.currentTimeMillis(), 36);
    private final List<Post> rows = new ArrayList<>();
    private PostStore reference;

    @BeforeAll
    void seed() {
        assertThat(postStore).isInstanceOf(PostgisPostStore.class);
        assertThat(postStore.findNearby(CENTER, 200.0, PageWindow.of(1, 1)))
                .as("posts table must start empty around the test center")
                .isEmpty();

        Random random = new Random(7);
        long created = Instant.parse("2024-01-01T00:00:00Z").toEpochMilli();
        for (int i = 0; i < 300; i++) {
            double lat = CENTER.latitude() + (random.nextDouble() - 0.5) * 1.0;
            double lng = CENTER.longitude() + (random.nextDouble() - 0.5) * 1.0;
            rows.add(row(run + "-p" + i, lat, lng, created + i * 1000L));
        }
        // same spot, different ages: distance ties must fall back to newest first
        for (int i = 0; i < 3; i++) {
            rows.add(row(run + "-tie" + i, 37.78, -122.41, created + 1_000_000L + i));
        }
        rows.add(Post.builder().id(run + "-unlocated").userId("u").content("no place")
                .createdAt(Instant.ofEpochMilli(created)).updatedAt(Instant.ofEpochMilli(created)).build());
        rows.forEach(postStore::insert);

        List<Post> newestFirst = new ArrayList<>(rows);
        newestFirst.sort(Comparator.comparing(Post::getCreatedAt).thenComparing(Post::getId).reversed());
        PostMapper mapper = mock(PostMapper.class);
        when(mapper.listInBoundingBox(anyDouble(), anyDouble(), anyDouble(), anyDouble(), anyBoolean()))
                .thenReturn(newestFirst);
        reference = new SqlitePostStore(mapper);
    }

    @Test
    void sameMembersAndOrderForSeveralRadii() {
        for (double radius : new double[]{0.5, 3.0, 10.0, 25.0, 80.0}) {
            List<String> expected = ids(reference.findNearby(CENTER, radius, PageWindow.unbounded()));
            List<String> actual = ids(postStore.findNearby(CENTER, radius, PageWindow.of(1, 1000)));

            assertThat(actual).as("radius=%s", radius).containsExactlyElementsOf(expected);
        }
    }

    @Test
    void samePages() {
        for (int page = 1; page <= 4; page++) {
            PageWindow window = PageWindow.of(page, 7);
            assertThat(ids(postStore.findNearby(CENTER, 10.0, window)))
                    .as("page=%s", page)
                    .containsExactlyElementsOf(ids(reference.findNearby(CENTER, 10.0, window)));
        }
    }

    @Test
    void pointExactlyOnTheRadiusIsIncluded() {
        Post onEdge = rows.get(0);
        double radius = GeoMath.distanceKm(CENTER, onEdge.getLatitude(), onEdge.getLongitude());

        assertThat(ids(postStore.findNearby(CENTER, radius, PageWindow.of(1, 1000)))).contains(onEdge.getId());
        assertThat(ids(reference.findNearby(CENTER, radius, PageWindow.unbounded()))).contains(onEdge.getId());
    }

    @Test
    void cityAndTextQueriesWorkOnPostgres() {
        Post p = row("city-" + System.nanoTime(), 48.8566, 2.3522, System.currentTimeMillis());
        p.setCity("Paris");
        p.setContent("Croissant QUEST");
        postStore.insert(p);

        assertThat(ids(postStore.listByCity("Paris", PageWindow.of(1, 20)))).contains(p.getId());
        assertThat(ids(postStore.searchByText("croissant quest", PageWindow.of(1, 20)))).contains(p.getId());
    }

    private static String externalUrl() {
        String v = System.getenv(URL_ENV);
        return (v == null || !v.startsWith("jdbc:postgresql:")) ? null : v;
    }

    private static String envOr(String name, String fallback) {
        String v = System.getenv(name);
        return (v == null || v.isBlank()) ? fallback : v;
    }

    private static Post row(String id, double lat, double lng, long createdMillis) {
        Instant at = Instant.ofEpochMilli(createdMillis);
        return Post.builder()
                .id(id)
                .userId("u")
                .content("post " + id)
                .latitude(lat)
                .longitude(lng)
                .createdAt(at)
                .updatedAt(at)
                .build();
    }

    private static List<String> ids(List<Post> posts) {
        List<String> out = new ArrayList<>(posts.size());
        posts.forEach(p -> out.add(p.getId()));
        return out;
    }
}
