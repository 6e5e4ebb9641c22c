package io.github.jakubt4.sdfits.coordinates;

import io.github.jakubt4.sdfits.config.OrekitConfig;
import io.github.jakubt4.sdfits.config.SiteConfig;
import io.github.jakubt4.sdfits.error.CoordinateTransformException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;
import org.orekit.bodies.GeodeticPoint;
import org.orekit.bodies.OneAxisEllipsoid;
import org.orekit.errors.OrekitException;
import org.orekit.frames.Frame;
import org.orekit.frames.FramesFactory;
import org.orekit.frames.TopocentricFrame;
import org.orekit.time.AbsoluteDate;
import org.orekit.time.TimeScalarFunction;
import org.orekit.time.TimeScale;
import org.orekit.time.TimeScalesFactory;
import org.orekit.utils.Constants;
import org.orekit.utils.IERSConventions;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.Date;
import java.util.List;

/**
 * Converts antenna pointing from horizontal coordinates to equatorial (ICRS) and galactic
 * coordinates, and derives local sidereal time and angular offsets.
 *
 * <p>For each sample one UTC {@link AbsoluteDate} drives both the sidereal time and the
 * topocentric to GCRF frame transform, so every derived quantity refers to the same
 * observation time and site. The horizontal direction is rotated as a direction at infinity
 * (no parallax). Annual aberration is removed with a low-precision solar model (better than
 * 0.5 arcsec); diurnal aberration and atmospheric refraction are not applied.
 *
 * <p>Calls are vectorised over a directory's full sample set.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CoordinateTransformService {

    // v/c of the Earth's orbital motion, i.e. the constant of aberration (20.49552 arcsec)
    private static final double ABERRATION = FastMath.toRadians(20.49552 / 3600.0);

    // IAU 1958 galactic pole and origin expressed in ICRS (Hipparcos realisation)
    private static final RealMatrix ICRS_TO_GALACTIC = MatrixUtils.createRealMatrix(new double[][]{
            {-0.0548755604162154, -0.8734370902348850, -0.4838350155487132},
            {+0.4941094278755837, -0.4448296299600112, +0.7469822444972189},
            {-0.8676661490190047, -0.1980763734312015, +0.4559837761750669}
    });

    @SuppressWarnings("unused") // injected to guarantee Orekit data is loaded before @PostConstruct
    private final OrekitConfig orekitConfig;

    private OneAxisEllipsoid earth;
    private Frame gcrf;
    private TimeScale utc;
    private TimeScalarFunction gmst;

    @PostConstruct
    void init() {
        final var itrf = FramesFactory.getITRF(IERSConventions.IERS_2010, true);
        earth = new OneAxisEllipsoid(
                Constants.WGS84_EARTH_EQUATORIAL_RADIUS,
                Constants.WGS84_EARTH_FLATTENING,
                itrf
        );
        gcrf = FramesFactory.getGCRF();
        utc = TimeScalesFactory.getUTC();
        gmst = IERSConventions.IERS_2010.getGMSTFunction(TimeScalesFactory.getUT1(IERSConventions.IERS_2010, true));
        log.info("Earth model initialized: WGS84 ellipsoid, ITRF/IERS-2010 to GCRF");
    }

    /**
     * Transforms a batch of horizontal pointings observed from {@code site}.
     *
     * <p>Samples that cannot be transformed (missing timestamp, non-finite or out-of-range
     * angles) are logged and left out of the result; see {@link SkyPositions#sourceRows()}.
     *
     * @param altitudes  elevation above the horizon, degrees
     * @param azimuths   azimuth clockwise from north, degrees
     * @param timestamps observation instants, UTC
     * @param site       observing site
     * @return transformed samples
     * @throws IllegalArgumentException if the three inputs differ in length
     */
    public SkyPositions toEquatorialAndGalactic(final double[] altitudes, final double[] azimuths,
                                                final List<Instant> timestamps, final SiteConfig site) {
        if (altitudes.length != azimuths.length || altitudes.length != timestamps.size()) {
            throw new IllegalArgumentException("Mismatched input lengths: alt=" + altitudes.length
                    + " az=" + azimuths.length + " time=" + timestamps.size());
        }

        final var count = altitudes.length;
        final var rows = new int[count];
        final var ra = new double[count];
        final var dec = new double[count];
        final var glon = new double[count];
        final var glat = new double[count];
        final var lst = new double[count];

        final var longitude = FastMath.toRadians(site.longitude());
        final var topocentric = new TopocentricFrame(earth,
                new GeodeticPoint(FastMath.toRadians(site.latitude()), longitude, site.elevation()),
                site.telescope());

        var accepted = 0;
        for (var i = 0; i < count; i++) {
            try {
                final var date = toDate(timestamps.get(i), i);
                final var direction = horizontalDirection(altitudes[i], azimuths[i], i);

                final var apparent = topocentric.getTransformTo(gcrf, date).transformVector(direction);
                final var equatorial = removeAnnualAberration(apparent, julianCenturies(date));
                final var galactic = toGalactic(equatorial);

                rows[accepted] = i;
                ra[accepted] = normalizeDegrees(equatorial.getAlpha());
                dec[accepted] = FastMath.toDegrees(equatorial.getDelta());
                glon[accepted] = normalizeDegrees(galactic.getAlpha());
                glat[accepted] = FastMath.toDegrees(galactic.getDelta());
                lst[accepted] = SiderealTime.toHours(gmst.value(date) + longitude);
                accepted++;
            } catch (final CoordinateTransformException e) {
                log.warn("Dropping pointing sample: {}", e.getMessage());
            } catch (final OrekitException e) {
                log.warn("Dropping pointing sample {}: frame transform failed: {}", i, e.getMessage());
            }
        }

        if (accepted < count) {
            log.warn("{} of {} pointing samples could not be transformed", count - accepted, count);
        }
        return new SkyPositions(
                Arrays.copyOf(rows, accepted),
                Arrays.copyOf(ra, accepted),
                Arrays.copyOf(dec, accepted),
                Arrays.copyOf(glon, accepted),
                Arrays.copyOf(glat, accepted),
                Arrays.copyOf(lst, accepted),
                count);
    }

    /**
     * Offsets of every position from the first one, measured in the tangent plane at the
     * first position. The sphere is rotated so that the first position lies at (0, 0); each
     * offset is then the longitude/latitude of the rotated point.
     *
     * @param ra  right ascension, degrees
     * @param dec declination, degrees
     * @return offsets in degrees; the first entry is always (0, 0)
     */
    public AngularOffsets angularOffset(final double[] ra, final double[] dec) {
        if (ra.length != dec.length) {
            throw new IllegalArgumentException("Mismatched input lengths: ra=" + ra.length + " dec=" + dec.length);
        }
        final var dLon = new double[ra.length];
        final var dLat = new double[ra.length];
        if (ra.length == 0) {
            return new AngularOffsets(dLon, dLat);
        }

        final var ra0 = FastMath.toRadians(ra[0]);
        final var sinDec0 = FastMath.sin(FastMath.toRadians(dec[0]));
        final var cosDec0 = FastMath.cos(FastMath.toRadians(dec[0]));

        for (var i = 0; i < ra.length; i++) {
            final var deltaRa = FastMath.toRadians(ra[i]) - ra0;
            final var delta = FastMath.toRadians(dec[i]);
            final var x1 = FastMath.cos(delta) * FastMath.cos(deltaRa);
            final var y1 = FastMath.cos(delta) * FastMath.sin(deltaRa);
            final var z1 = FastMath.sin(delta);

            // rotate about the y axis so the reference lands on the equator
            final var x2 = x1 * cosDec0 + z1 * sinDec0;
            final var z2 = z1 * cosDec0 - x1 * sinDec0;

            dLon[i] = FastMath.toDegrees(FastMath.atan2(y1, x2));
            dLat[i] = FastMath.toDegrees(FastMath.atan2(z2, FastMath.hypot(x2, y1)));
        }
        return new AngularOffsets(dLon, dLat);
    }

    private AbsoluteDate toDate(final Instant timestamp, final int sample) {
        if (timestamp == null) {
            throw new CoordinateTransformException("sample " + sample + " has no timestamp");
        }
        try {
            return new AbsoluteDate(Date.from(timestamp), utc);
        } catch (final IllegalArgumentException | OrekitException e) {
            throw new CoordinateTransformException("sample " + sample + " has an invalid timestamp " + timestamp, e);
        }
    }

    // east, north and zenith are the x, y and z axes of a TopocentricFrame
    private static Vector3D horizontalDirection(final double altitude, final double azimuth, final int sample) {
        if (!Double.isFinite(altitude) || altitude < -90.0 || altitude > 90.0) {
            throw new CoordinateTransformException("sample " + sample + " has altitude out of range: " + altitude);
        }
        if (!Double.isFinite(azimuth)) {
            throw new CoordinateTransformException("sample " + sample + " has a non-finite azimuth: " + azimuth);
        }
        final var el = FastMath.toRadians(altitude);
        final var az = FastMath.toRadians(azimuth);
        return new Vector3D(FastMath.cos(el) * FastMath.sin(az), FastMath.cos(el) * FastMath.cos(az), FastMath.sin(el));
    }

    private static double julianCenturies(final AbsoluteDate date) {
        return date.durationFrom(AbsoluteDate.J2000_EPOCH) / Constants.JULIAN_CENTURY;
    }

    /**
     * Maps an apparent direction back to its catalogue direction by subtracting the Earth's
     * orbital velocity, to first order in v/c.
     *
     * @param apparent  observed direction in GCRF
     * @param centuries Julian centuries since J2000
     */
    static Vector3D removeAnnualAberration(final Vector3D apparent, final double centuries) {
        final var meanLongitude = FastMath.toRadians(280.46646 + 36000.76983 * centuries);
        final var meanAnomaly = FastMath.toRadians(357.52911 + 35999.05029 * centuries);
        final var sunLongitude = meanLongitude
                + FastMath.toRadians(1.914602 * FastMath.sin(meanAnomaly) + 0.019993 * FastMath.sin(2.0 * meanAnomaly));
        final var obliquity = FastMath.toRadians(23.439291 - 0.0130042 * centuries);

        // the Earth moves 90 degrees behind the Sun's apparent longitude
        final var vx = ABERRATION * FastMath.sin(sunLongitude);
        final var vy = -ABERRATION * FastMath.cos(sunLongitude) * FastMath.cos(obliquity);
        final var vz = -ABERRATION * FastMath.cos(sunLongitude) * FastMath.sin(obliquity);
        final var velocity = new Vector3D(vx, vy, vz);

        final var u = apparent.normalize();
        return u.subtract(velocity).add(u.scalarMultiply(Vector3D.dotProduct(u, velocity))).normalize();
    }

    private static Vector3D toGalactic(final Vector3D equatorial) {
        final var rotated = ICRS_TO_GALACTIC.operate(equatorial.normalize().toArray());
        return new Vector3D(rotated[0], rotated[1], rotated[2]);
    }

    private static double normalizeDegrees(final double radians) {
        final var degrees = FastMath.toDegrees(MathUtils.normalizeAngle(radians, FastMath.PI));
        return degrees >= 360.0 ? 0.0 : degrees;
    }
}
