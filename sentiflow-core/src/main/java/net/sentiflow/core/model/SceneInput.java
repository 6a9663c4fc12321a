package net.sentiflow.core.model;

import java.nio.file.Path;

/**
 * import 대상 장면 입력.
 * @param location    import 할 디렉터리
 * @param patternFile 평면 디렉터리에서 장면을 고르는 이름(.SAFE/.zip 제외), 장면별 폴더면 null
 * @param product     .SAFE 제품 경로 (대기보정 입력), 없으면 null
 */
public record SceneInput(String id, Path location, String patternFile, Path product) {

    public boolean hasSafeProduct() {
        return product != null && product.getFileName().toString().endsWith(".SAFE");
    }
}
