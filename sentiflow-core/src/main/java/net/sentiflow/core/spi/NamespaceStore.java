package net.sentiflow.core.spi;

import net.sentiflow.core.model.Artifact;
import net.sentiflow.core.model.NamespaceFingerprint;

import java.nio.file.Path;
import java.util.List;

/**
 * 아티팩트를 담는 이름 공간들.
 * 공유 네임스페이스 하나와 워커별 private 네임스페이스로 구성된다.
 */
public interface NamespaceStore {

    /** 호출자가 지금 바라보는 네임스페이스 이름 (격리 검증용) */
    String activeNamespace() throws Exception;

    boolean exists(String namespace) throws Exception;

    /** 비어 있는 네임스페이스 생성. 이미 있으면 비운 뒤 다시 만든다. */
    void create(String namespace) throws Exception;

    /** 없으면 무시 */
    void delete(String namespace) throws Exception;

    /** 해당 접두사로 시작하는 네임스페이스 목록 */
    List<String> namespaces(String prefix) throws Exception;

    /** 워커 전용 설정 사본을 만든다 (세션 포인터를 공유하지 않기 위해). */
    Path privateConfig(String namespace) throws Exception;

    List<Artifact> list(String namespace) throws Exception;

    boolean contains(String namespace, Artifact artifact) throws Exception;

    /** 같은 이름이 있으면 덮어쓴다. */
    void copy(String fromNamespace, Artifact artifact, String toNamespace) throws Exception;

    void remove(String namespace, Artifact artifact) throws Exception;

    /** 값이 전부 null 인 레이어인지 */
    boolean isNull(String namespace, Artifact artifact) throws Exception;

    NamespaceFingerprint fingerprint(String namespace) throws Exception;
}
