package com.qaradar.core.service.export;

import com.qaradar.core.model.DiscoveryBrief;

import java.io.IOException;
import java.nio.file.Path;

/** 브리프를 파일로 내보내는 책임. 밴드/신뢰도는 다시 계산하지 않는다. */
public interface BriefExporter {
    /**
     * @param baseDir 출력 루트 (null이면 "out")
     * @param brief   조립이 끝난 브리프
     * @return 생성된 파일 경로
     */
    Path export(Path baseDir, DiscoveryBrief brief) throws IOException;
}
