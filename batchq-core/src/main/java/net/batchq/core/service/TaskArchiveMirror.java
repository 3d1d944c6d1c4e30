package net.batchq.core.service;

import net.batchq.core.model.TaskEvent;
import net.batchq.core.spi.TaskArchive;
import net.batchq.core.spi.TaskEventListener;
import net.batchq.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 모든 태스크 전이를 아카이브에 upsert.
 * best-effort: 저장 실패는 메모리 상태에 영향을 주지 않고 error 로그만 남긴다.
 */
public final class TaskArchiveMirror implements TaskEventListener {
    private static final Logger log = LoggerFactory.getLogger(TaskArchiveMirror.class);

    private final TaskArchive archive;
    private final TxRunner tx;

    public TaskArchiveMirror(TaskArchive archive, TxRunner tx) {
        this.archive = archive;
        this.tx = tx;
    }

    @Override
    public void onTaskEvent(TaskEvent event) {
        try {
            tx.execute(() -> archive.save(event.task()));
        } catch (Exception e) {
            log.error("archive save failed: task={} event={} status={}",
                    event.task().id(), event.type(), event.task().status(), e);
        }
    }
}
