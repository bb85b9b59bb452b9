package com.sonet.geo;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeoMathTest {

    private static final double SF_LAT = 37.7749;
    private static final double SF_LNG = -122.4194;
    private static final double LA_LAT = 34.0522;
    private static final double LA_LNG = -118.2437;

    @Test
    void distanceToSelfIsZero() {
        assertThat(GeoMath.distanceKm(SF_LAT, SF_LNG, SF_LAT, SF_LNG)).isEqualTo(0.0);
    }

    @Test
    void distanceIsSymmetric() {
        double there = GeoMath.distanceKm(SF_LAT, SF_LNG, LA_LAT, LA_LNG);
        double back = GeoMath.distanceKm(LA_LAT, LA_LNG, SF_LAT, SF_LNG);
        assertThat(there).isCloseTo(back, within(1e-9));
    }

    @Test
    void sanFranciscoToLosAngelesIsAbout559Km() {
        assertThat(GeoMath.distanceKm(SF_LAT, SF_LNG, LA_LAT, LA_LNG)).isCloseTo(559.0, within(2.0));
    }

    @Test
    void oneDegreeOfLatitudeIsAbout111Km() {
        assertThat(GeoMath.distanceKm(0, 0, 1, 0)).isCloseTo(111.19, within(0.01));
    }

    @Test
    void antipodalPointsAreHalfACircumferenceApart() {
        double d = GeoMath.distanceKm(0, 0, 0, 180);
        assertThat(d).isCloseTo(Math.PI * GeoMath.EARTH_RADIUS_KM, within(1e-6));
        assertThat(Double.isNaN(d)).isFalse();
    }

    @Test
    void pointFiftyKmAwayIsOutsideTenKmAndOneKmAwayIsInside() {
        double[] far = destination(SF_LAT, SF_LNG, 50.0, 90.0);
        double[] near = destination(SF_LAT, SF_LNG, 1.0, 90.0);

        assertThat(GeoMath.withinRadius(GeoMath.distanceKm(SF_LAT, SF_LNG, far[0], far[1]), 10.0)).isFalse();
        assertThat(GeoMath.withinRadius(GeoMath.distanceKm(SF_LAT, SF_LNG, near[0], near[1]), 10.0)).isTrue();
    }

    @Test
    void radiusIsInclusive() {
        assertThat(GeoMath.withinRadius(10.0, 10.0)).isTrue();
        assertThat(GeoMath.withinRadius(10.0 + 1e-6, 10.0)).isFalse();
    }

    @Test
    void boxContainsCenterAndIsBoundedAtMidLatitudes() {
        BoundingBox box = GeoMath.estimateBoundingBox(SF_LAT, SF_LNG, 10.0);

        assertThat(box.longitudeBounded()).isTrue();
        assertThat(box.contains(SF_LAT, SF_LNG)).isTrue();
        assertThat(box.minLat()).isLessThan(SF_LAT);
        assertThat(box.maxLat()).isGreaterThan(SF_LAT);
        assertThat(box.contains(LA_LAT, LA_LNG)).isFalse();
    }

    @Test
    void boxNeverMissesAPointInsideTheRadius() {
        Random random = new Random(42);
        for (int i = 0; i < 5_000; i++) {
            double lat = -89.0 + random.nextDouble() * 178.0;
            double lng = -179.9 + random.nextDouble() * 359.8;
            double radius = 0.5 + random.nextDouble() * 2_000.0;
            double bearing = random.nextDouble() * 360.0;
            double distance = random.nextDouble() * radius;

            double[] p = destination(lat, lng, distance, bearing);
            if (!GeoMath.withinRadius(GeoMath.distanceKm(lat, lng, p[0], p[1]), radius)) {
                continue;
            }
            BoundingBox box = GeoMath.estimateBoundingBox(lat, lng, radius);
            assertThat(box.contains(p[0], p[1]))
                    .as("center=(%s,%s) radius=%s point=(%s,%s)", lat, lng, radius, p[0], p[1])
                    .isTrue();
        }
    }

    @Test
    void boxTouchingAPoleSpansAllLongitudes() {
        BoundingBox box = GeoMath.estimateBoundingBox(89.95, 10.0, 20.0);

        assertThat(box.longitudeBounded()).isFalse();
        assertThat(box.maxLat()).isEqualTo(90.0);
        assertThat(box.contains(89.99, -170.0)).isTrue();
    }

    @Test
    void boxCrossingTheAntimeridianSpansAllLongitudes() {
        BoundingBox box = GeoMath.estimateBoundingBox(0.0, 179.95, 50.0);

        assertThat(box.longitudeBounded()).isFalse();
        assertThat(box.contains(0.0, -179.9)).isTrue();
    }

    @Test
    void postgisRadiusKeepsTheSameAngle() {
        double meters = GeoMath.toPostgisSphereMeters(10.0);
        double angleOurs = 10.0 / GeoMath.EARTH_RADIUS_KM;
        double anglePostgis = meters / GeoMath.POSTGIS_SPHERE_RADIUS_M;

        assertThat(anglePostgis).isCloseTo(angleOurs, within(1e-12));
        assertThat(meters).isGreaterThan(10_000.0);
    }

    /**
     * Point reached from (lat, lng) after {@code distanceKm} along {@code bearingDeg}, on the
     * same sphere the distance function uses.
     */
    static double[] destination(double lat, double lng, double distanceKm, double bearingDeg) {
        double delta = distanceKm / GeoMath.EARTH_RADIUS_KM;
        double theta = Math.toRadians(bearingDeg);
        double phi1 = Math.toRadians(lat);
        double lambda1 = Math.toRadians(lng);

        double phi2 = Math.asin(Math.sin(phi1) * Math.cos(delta)
                + Math.cos(phi1) * Math.sin(delta) * Math.cos(theta));
        double lambda2 = lambda1 + Math.atan2(
                Math.sin(theta) * Math.sin(delta) * Math.cos(phi1),
                Math.cos(delta) - Math.sin(phi1) * Math.sin(phi2));

        double lng2 = (Math.toDegrees(lambda2) + 540.0) % 360.0 - 180.0;
        return new double[]{Math.toDegrees(phi2), lng2};
    }
}
