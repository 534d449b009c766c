package com.pagerwatch.service.config;

/**
 * Where decoder lines come from. {@code path} is used in {@link DecoderMode#FILE} mode (a capture
 * file or a named pipe), {@code command} in {@link DecoderMode#COMMAND} mode.
 */
public record DecoderConfig(DecoderMode mode, String path, String command) {
    public static final String DEFAULT_COMMAND = "rtl_fm -f 169.65M -M fm -s 22050 -p 83 -g 30 | multimon-ng -a FLEX -t raw -";

    public DecoderConfig {
        mode = mode == null ? DecoderMode.STDIN : mode;
        command = command == null || command.isBlank() ? DEFAULT_COMMAND : command;
    }

    public static DecoderConfig stdin() {
        return new DecoderConfig(DecoderMode.STDIN, null, null);
    }
}
