package com.spicegui.file;

import com.spicegui.util.StringUtil;

import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Mensajes de los importadores y exportadores ({@code resources/spicegui/importer.properties}).
 */
public final class Strings {
    private static final ResourceBundle source = ResourceBundle.getBundle("resources.spicegui.importer");

    private Strings() { }

    public static String get(String key) {
        try {
            return source.getString(key);
        } catch (MissingResourceException ex) {
            // clave sin traducir: se muestra tal cual
            return key;
        }
    }

    public static String get(String key, String... args) {
        return StringUtil.format(get(key), args);
    }

    public static String get(String key, int n) {
        return StringUtil.format(get(key), String.valueOf(n));
    }
}
