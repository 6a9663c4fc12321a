package net.sentiflow.core.spi;

import net.sentiflow.core.model.SceneInput;

import java.nio.file.Path;
import java.util.List;

/** import 입력 디렉터리에서 장면 단위 입력을 찾는다. */
public interface SceneSource {
    /**
     * @param singleFolders true 면 하위 폴더 하나가 장면 하나, false 면 .SAFE/.zip 항목이 장면 하나
     */
    List<SceneInput> scan(Path directory, boolean singleFolders) throws Exception;
}
