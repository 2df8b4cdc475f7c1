package net.multicli.util.config;

public interface Configuration {

    String HELP_WIDTH = "multicli.help.width";
    String PROG_NAME = "multicli.prog";
    String LOG_LEVEL = "multicli.log.level";

    Configuration DEFAULT = DynamicConfiguration.makeDefault();

    String get(String key);

}
