package org.broadinstitute.scbfa.conf;

import org.apache.commons.configuration.BaseConfiguration;
import org.broadinstitute.scbfa.ScBfaBaseTest;
import org.broadinstitute.scbfa.bfa.BinaryFactorAnalysis;
import org.broadinstitute.scbfa.binarypca.DetectionTransform;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.NoSuchElementException;

public final class ScBfaConfBuilderUnitTest extends ScBfaBaseTest {

    @Test
    public void testDefaults() {
        final ScBfaConf conf = ScBfaConfBuilder.getDefaultConfiguration();
        Assert.assertEquals(conf.getInt(ScBfaConf.MAX_ITERATIONS_KEY), 300);
        Assert.assertEquals(conf.getDouble(ScBfaConf.TOLERANCE_KEY), 1e-6);
        Assert.assertEquals(conf.getDouble(ScBfaConf.EPSILON_KEY), 1e-6);
        Assert.assertEquals(conf.getDouble(ScBfaConf.L2_PENALTY_KEY), 1.0);
        Assert.assertEquals(conf.getDouble(ScBfaConf.CLIP_DELTA_KEY), 0.1);
        Assert.assertEquals(conf.getLong(ScBfaConf.SEED_KEY), 1337L);
        Assert.assertFalse(conf.getBoolean(ScBfaConf.PARALLEL_SWEEPS_KEY));
        Assert.assertEquals(conf.getInt(ScBfaConf.VERBOSE_INTERVAL_KEY), 10);
        Assert.assertEquals(conf.getEnum(ScBfaConf.INIT_METHOD_KEY, BinaryFactorAnalysis.InitMethod.class),
                BinaryFactorAnalysis.InitMethod.SVD);
        Assert.assertEquals(conf.getEnum(ScBfaConf.PCA_TRANSFORM_KEY, DetectionTransform.class),
                DetectionTransform.INVERSE_DETECTION_FREQUENCY);
        Assert.assertEquals(conf.getDouble(ScBfaConf.PCA_MIN_DETECTION_VARIANCE_KEY), 1e-8);
    }

    @Test
    public void testEveryKeyHasADefault() {
        final ScBfaConf conf = ScBfaConfBuilder.getDefaultConfiguration();
        for (final String key : Arrays.asList(ScBfaConf.MAX_ITERATIONS_KEY, ScBfaConf.TOLERANCE_KEY, ScBfaConf.EPSILON_KEY,
                ScBfaConf.RIDGE_KEY, ScBfaConf.MAX_RIDGE_KEY, ScBfaConf.CONDITION_THRESHOLD_KEY, ScBfaConf.L2_PENALTY_KEY,
                ScBfaConf.CLIP_DELTA_KEY, ScBfaConf.INIT_METHOD_KEY, ScBfaConf.RANDOM_INIT_SCALE_KEY, ScBfaConf.SEED_KEY,
                ScBfaConf.NOISE_TOLERANCE_KEY, ScBfaConf.MAX_STEP_HALVINGS_KEY, ScBfaConf.PARALLEL_SWEEPS_KEY,
                ScBfaConf.VERBOSE_INTERVAL_KEY, ScBfaConf.PCA_TRANSFORM_KEY, ScBfaConf.PCA_MIN_DETECTION_VARIANCE_KEY)) {
            Assert.assertTrue(conf.containsKey(key), key);
        }
    }

    @Test
    public void testProgrammaticOverride() {
        final ScBfaConf conf = new ScBfaConfBuilder()
                .setDefaults()
                .setProperty(ScBfaConf.MAX_ITERATIONS_KEY, 25)
                .setProperty(ScBfaConf.INIT_METHOD_KEY, "random")
                .getConfiguration();
        Assert.assertEquals(conf.getInt(ScBfaConf.MAX_ITERATIONS_KEY), 25);
        Assert.assertEquals(conf.getEnum(ScBfaConf.INIT_METHOD_KEY, BinaryFactorAnalysis.InitMethod.class),
                BinaryFactorAnalysis.InitMethod.RANDOM);
        Assert.assertEquals(conf.getDouble(ScBfaConf.TOLERANCE_KEY), 1e-6);
    }

    @Test
    public void testFileOverride() throws IOException {
        final File file = File.createTempFile("scbfa-test", ".properties");
        file.deleteOnExit();
        Files.write(file.toPath(), Arrays.asList("scbfa.tolerance=1e-3", "scbfa.pca.transform=PEARSON_RESIDUAL"),
                StandardCharsets.UTF_8);
        final ScBfaConf conf = new ScBfaConfBuilder().setDefaults().loadFile(file).getConfiguration();
        Assert.assertEquals(conf.getDouble(ScBfaConf.TOLERANCE_KEY), 1e-3);
        Assert.assertEquals(conf.getEnum(ScBfaConf.PCA_TRANSFORM_KEY, DetectionTransform.class),
                DetectionTransform.PEARSON_RESIDUAL);
        Assert.assertEquals(conf.getInt(ScBfaConf.MAX_ITERATIONS_KEY), 300);
    }

    @Test
    public void testUseConfiguration() {
        final BaseConfiguration configuration = new BaseConfiguration();
        configuration.setProperty(ScBfaConf.SCBFA_PROPERTY_PREFIX + ScBfaConf.SEED_KEY, 42L);
        final ScBfaConf conf = ScBfaConfBuilder.useConfiguration(configuration);
        Assert.assertEquals(conf.getLong(ScBfaConf.SEED_KEY), 42L);
        Assert.assertFalse(conf.containsKey(ScBfaConf.TOLERANCE_KEY));
    }

    @Test(expectedExceptions = NoSuchElementException.class)
    public void testMissingKey() {
        new ScBfaConfBuilder().getConfiguration().getInt(ScBfaConf.MAX_ITERATIONS_KEY);
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = ".*Invalid value \"SPECTRAL\".*")
    public void testInvalidEnumValue() {
        new ScBfaConfBuilder().setDefaults()
                .setProperty(ScBfaConf.INIT_METHOD_KEY, "SPECTRAL")
                .getConfiguration()
                .getEnum(ScBfaConf.INIT_METHOD_KEY, BinaryFactorAnalysis.InitMethod.class);
    }
}
