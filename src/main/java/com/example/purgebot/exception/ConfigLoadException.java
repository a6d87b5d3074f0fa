package com.example.purgebot.exception;

/**
 * 配置文件无法读取或解析。
 */
public class ConfigLoadException extends RuntimeException {

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
