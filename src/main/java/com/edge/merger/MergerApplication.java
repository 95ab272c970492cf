package com.edge.merger;

import com.edge.merger.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MergerApplication {

    public static void main(String[] args) {
        // OpenCV 必须在任何 Mat 创建之前加载
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(MergerApplication.class, args);
    }
}
