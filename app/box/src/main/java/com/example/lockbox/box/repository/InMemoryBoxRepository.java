/*
 * どこで: Box データアクセス(インメモリ実装)
 * 何を: ConcurrentHashMap 上で version の compare-and-swap を行う
 * なぜ: ローカル起動とテストで DB なしに同じ楽観的排他の契約を再現するため
 */
package com.example.lockbox.box.repository;

import com.example.lockbox.box.model.BoxRecord;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "box.store.type", havingValue = "memory")
public class InMemoryBoxRepository implements BoxRepository {

  // インスタンスごとに独立したストア。テストは並列に別ストアを使える
  private final ConcurrentMap<String, BoxRecord> boxes = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryBoxRepository(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<BoxRecord> findById(String id) {
    return Optional.ofNullable(boxes.get(id));
  }

  @Override
  public List<BoxRecord> findByOwnerId(String ownerId) {
    return boxes.values().stream()
        .filter(box -> box.isOwnedBy(ownerId))
        .sorted(Comparator.comparing(BoxRecord::updatedAt).reversed())
        .toList();
  }

  @Override
  public List<BoxRecord> findByGuardianId(String userId) {
    return boxes.values().stream()
        .filter(box -> box.findGuardianById(userId).isPresent())
        .sorted(Comparator.comparing(BoxRecord::updatedAt).reversed())
        .toList();
  }

  @Override
  public BoxRecord create(BoxRecord box) {
    final BoxRecord created = box.withCommit(0L, box.updatedAt());
    final BoxRecord existing = boxes.putIfAbsent(box.id(), created);
    if (existing != null) {
      throw new BoxStoreException("box already exists: " + box.id());
    }
    return created;
  }

  @Override
  public BoxRecord update(BoxRecord box) {
    final Instant now = Instant.now(clock);
    // compute はキー単位で原子的に実行されるため、version 比較と書き込みの間に割り込みは入らない
    final BoxRecord[] committed = new BoxRecord[1];
    boxes.compute(
        box.id(),
        (id, current) -> {
          if (current == null) {
            throw new BoxNotFoundException(id);
          }
          if (current.version() != box.version()) {
            throw new VersionConflictException(id, box.version());
          }
          committed[0] = box.withCommit(current.version() + 1, now);
          return committed[0];
        });
    return committed[0];
  }

  @Override
  public void delete(String id) {
    if (boxes.remove(id) == null) {
      throw new BoxNotFoundException(id);
    }
  }
}
