package com.mk.fx.qa.load.ramp;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.ramp.cfg.RampConfigLoader;
import com.mk.fx.qa.load.ramp.exception.RampConfigurationException;
import com.mk.fx.qa.load.ramp.service.LoadRampService;
import java.nio.file.Path;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Reads {@code --config <path>} (or {@code --config=<path>}) and runs that ramp once. A missing or
 * invalid configuration ends the process with {@link RampConfigurationException#EXIT_CODE}.
 */
@Slf4j
@Component
public class LoadRampCommand implements ApplicationRunner {

  static final String CONFIG_OPTION = "config";

  private final RampConfigLoader configLoader;
  private final LoadRampService rampService;

  public LoadRampCommand(RampConfigLoader configLoader, LoadRampService rampService) {
    this.configLoader = configLoader;
    this.rampService = rampService;
  }

  @Override
  public void run(ApplicationArguments args) throws Exception {
    var configPath =
        configPath(args)
            .orElseThrow(
                () ->
                    new RampConfigurationException(
                        "Missing required option: --" + CONFIG_OPTION + " <path to JSON file>"));

    var config = configLoader.load(configPath);
    var result = rampService.run(config);
    log.info(
        "Completed {} steps with {} requests in total",
        result.steps().size(),
        result.totalRequests());
  }

  @VisibleForTesting
  static Optional<Path> configPath(ApplicationArguments args) {
    if (args.containsOption(CONFIG_OPTION)) {
      var values = args.getOptionValues(CONFIG_OPTION);
      if (values != null && !values.isEmpty() && !values.get(0).isBlank()) {
        return Optional.of(Path.of(values.get(0)));
      }
    }
    // "--config <path>" is not an option to Spring, only "--config=<path>" is
    var source = args.getSourceArgs();
    for (int i = 0; i < source.length - 1; i++) {
      if (("--" + CONFIG_OPTION).equals(source[i]) && !source[i + 1].startsWith("--")) {
        return Optional.of(Path.of(source[i + 1]));
      }
    }
    return Optional.empty();
  }
}
