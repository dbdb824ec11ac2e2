package com.contextsmith.daac;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Properties;

import org.junit.After;
import org.junit.Test;

import com.contextsmith.daac.utils.FileUtil;

public class AutomatonConfigTest {

  @After
  public void clearSystemProperties() {
    System.clearProperty(AutomatonConfig.MAX_SLOT_TRIALS_KEY);
  }

  @Test
  public void testDefaults() {
    AutomatonConfig config = AutomatonConfig.getDefaults();
    assertEquals(1 << 20, config.getMaxPatternLength());
    assertEquals(Integer.MAX_VALUE - 8, config.getMaxArraySize());
    assertEquals(16, config.getMaxSlotTrials());
  }

  @Test
  public void testFromPropertiesFile() {
    Properties props = FileUtil.loadProperties("daac-test.properties");
    AutomatonConfig config = AutomatonConfig.fromProperties(props);
    assertEquals(8, config.getMaxPatternLength());
    assertEquals(4096, config.getMaxArraySize());
    assertEquals(4, config.getMaxSlotTrials());
  }

  @Test
  public void testMissingKeysUseDefaults() {
    AutomatonConfig config = AutomatonConfig.fromProperties(
        FileUtil.loadProperties("no-such-file.properties"));
    assertEquals(AutomatonConfig.DEFAULT_MAX_PATTERN_LENGTH, config.getMaxPatternLength());
    assertEquals(AutomatonConfig.DEFAULT_MAX_ARRAY_SIZE, config.getMaxArraySize());
    assertEquals(AutomatonConfig.DEFAULT_MAX_SLOT_TRIALS, config.getMaxSlotTrials());
  }

  @Test
  public void testSystemPropertyOverrides() {
    Properties props = new Properties();
    props.setProperty(AutomatonConfig.MAX_SLOT_TRIALS_KEY, "4");
    System.setProperty(AutomatonConfig.MAX_SLOT_TRIALS_KEY, "7");
    assertEquals(7, AutomatonConfig.fromProperties(props).getMaxSlotTrials());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNotAnInteger() {
    Properties props = new Properties();
    props.setProperty(AutomatonConfig.MAX_ARRAY_SIZE_KEY, "lots");
    AutomatonConfig.fromProperties(props);
  }

  @Test
  public void testPatternLengthLimitFromFile() throws Exception {
    AutomatonConfig config = AutomatonConfig.fromProperties(
        FileUtil.loadProperties("daac-test.properties"));
    try {
      new AutomatonBuilder(config).build(Arrays.asList("abcdefghi"));
      fail("Expected InvalidInputException");
    } catch (InvalidInputException e) {
      // Expected.
    }
  }
}
