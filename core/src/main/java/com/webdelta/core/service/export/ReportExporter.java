package com.webdelta.core.service.export;

import com.webdelta.core.model.MigrationReport;

import java.io.IOException;
import java.nio.file.Path;

/** 비교 보고서를 파일로 내보내는 책임 (JSON/Markdown) */
public interface ReportExporter {
    /**
     * @param baseDir 출력 루트 (null이면 "out")
     * @param report  집계된 보고서
     * @return 생성된 파일의 경로
     */
    Path export(Path baseDir, MigrationReport report) throws IOException;
}
