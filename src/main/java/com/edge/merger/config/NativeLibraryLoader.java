package com.edge.merger.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Native Library Loader
 * 负责加载 OpenCV JNI 库：JAR 模式下使用 openpnp 自带的库，native-image 模式下从应用目录或系统路径加载
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static final String OPENCV_LIB = "opencv_java470";

    private static boolean loaded = false;

    /**
     * 预加载 OpenCV，必须在任何 Mat 创建之前调用，可重复调用
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }

        boolean isNativeImage = System.getProperty("org.graalvm.nativeimage.imagecode") != null;
        if (isNativeImage) {
            logger.info("Running in native-image mode, loading OpenCV from application directory...");
            loadOpenCVNative(getApplicationDirectory());
        } else {
            logger.info("Running in JAR mode, loading OpenCV via openpnp...");
            try {
                nu.pattern.OpenCV.loadLocally();
                logger.info("OpenCV loaded successfully via openpnp (JAR mode)");
            } catch (UnsatisfiedLinkError e) {
                logger.error("Failed to load OpenCV library", e);
                throw new IllegalStateException("Failed to load OpenCV library", e);
            }
        }
        loaded = true;
    }

    private static String getApplicationDirectory() {
        String path = System.getProperty("user.dir");
        String libFileName = libraryFileName();

        File appDir = new File(path);
        if (new File(appDir, libFileName).exists()) {
            return path;
        }
        // macOS .app 包等情况下库在上级目录
        File parentDir = appDir.getParentFile();
        if (parentDir != null && new File(parentDir, libFileName).exists()) {
            logger.debug("Found OpenCV in parent directory: {}", parentDir.getAbsolutePath());
            return parentDir.getAbsolutePath();
        }
        return path;
    }

    private static String libraryFileName() {
        String osName = System.getProperty("os.name").toLowerCase();
        // openpnp 的 OpenCV 在 Windows 上没有 lib 前缀
        if (osName.contains("win")) {
            return OPENCV_LIB + ".dll";
        } else if (osName.contains("mac")) {
            return "lib" + OPENCV_LIB + ".dylib";
        }
        return "lib" + OPENCV_LIB + ".so";
    }

    private static void loadOpenCVNative(String appDir) {
        File libFile = new File(appDir, libraryFileName());
        if (libFile.exists()) {
            try {
                System.load(libFile.getAbsolutePath());
                logger.info("OpenCV loaded successfully from: {}", libFile.getAbsolutePath());
                return;
            } catch (UnsatisfiedLinkError e) {
                logger.warn("Failed to load OpenCV from {}: {}", libFile, e.getMessage());
            }
        }

        // 回退到系统库路径
        try {
            System.loadLibrary(OPENCV_LIB);
            logger.info("OpenCV loaded successfully from system library path");
        } catch (UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV library. Please ensure {} is in the application directory or system library path",
                    libraryFileName());
            throw new IllegalStateException("OpenCV native library not found: " + libraryFileName(), e);
        }
    }
}
