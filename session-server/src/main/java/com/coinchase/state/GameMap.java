package com.coinchase.state;

import com.coinchase.protocol.AttackEvent;
import com.coinchase.protocol.StatusEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Square grid of cells holding users, coins and items.
 *
 * Thread Safety:
 * - One read/write lock guards the grid; snapshot reads take the read lock
 *   so senders on different sessions never block each other
 * - Cells are immutable, so a returned {@link RelatedPosition} stays valid
 *   after the lock is released
 */
public class GameMap implements GameState {

    private static final Logger logger = LoggerFactory.getLogger(GameMap.class);

    public static final int BASE_VISIBILITY = 5;
    public static final int ITEM_VISIBILITY_BONUS = 2;

    private final int size;
    private final Cell[][] cells;
    private final UserStatuses userStatuses;
    private final InMemoryScoreboard scoreboard;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private int coinCount;
    private int itemCount;

    public GameMap(int size, UserStatuses userStatuses, InMemoryScoreboard scoreboard) {
        if (size <= 0) {
            throw new IllegalArgumentException("map size must be positive: " + size);
        }
        this.size = size;
        this.userStatuses = userStatuses;
        this.scoreboard = scoreboard;
        this.cells = new Cell[size][size];
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                cells[row][col] = Cell.EMPTY_GROUND;
            }
        }
    }

    /**
     * Drops up to {@code count} coins on random free cells. Positions that are
     * picked twice are skipped, so fewer coins than requested may land.
     */
    public void placeCoins(int count, Random random) {
        lock.writeLock().lock();
        try {
            for (int i = 0; i < count; i++) {
                int x = random.nextInt(size);
                int y = random.nextInt(size);
                if (cells[y][x].getKind() == CellKind.GROUND && !cells[y][x].isOccupied()) {
                    cells[y][x] = cells[y][x].withKind(CellKind.COIN);
                    coinCount++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Placed {} coins on a {}x{} map", coinCount, size, size);
    }

    /**
     * Drops exactly {@code count} items, retrying taken cells.
     */
    public void placeItems(int count, Random random) {
        lock.writeLock().lock();
        try {
            if (count > freeGroundCells()) {
                throw new IllegalArgumentException("not enough free cells for " + count + " items");
            }
            int placed = 0;
            while (placed < count) {
                int x = random.nextInt(size);
                int y = random.nextInt(size);
                if (cells[y][x].getKind() == CellKind.GROUND && !cells[y][x].isOccupied()) {
                    cells[y][x] = cells[y][x].withKind(CellKind.ITEM);
                    placed++;
                }
            }
            itemCount += placed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void updateUserPosition(StatusEvent status) {
        Position target = clamp(status.getCurrentPosition());
        String userId = status.getUserId();

        lock.writeLock().lock();
        try {
            UserStatus previous = userStatuses.getUserStatus(userId);
            int itemEffect = 0;
            if (previous != null) {
                itemEffect = previous.getItemEffect();
                vacate(previous.getPosition(), userId);
            }

            Cell cell = cellAt(target);
            switch (cell.getKind()) {
                case COIN -> {
                    cell = cell.withKind(CellKind.GROUND);
                    coinCount--;
                    scoreboard.addScore(userId, 1);
                }
                case ITEM -> {
                    cell = cell.withKind(CellKind.GROUND);
                    itemCount--;
                    itemEffect += ITEM_VISIBILITY_BONUS;
                }
                default -> {
                }
            }
            cells[target.getY()][target.getX()] = cell.occupiedBy(userId);
            userStatuses.putUserStatus(new UserStatus(userId, target, itemEffect));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void applyAttack(AttackEvent attack) {
        Position from = clamp(attack.getUserPosition());
        Position target = clamp(attack.getAttackPosition());

        if (from.distanceTo(target) > 1) {
            logger.debug("Attack by {} out of reach: {} -> {}", attack.getUserId(), from, target);
            return;
        }

        String victim;
        lock.readLock().lock();
        try {
            Cell cell = cellAt(target);
            victim = cell.isOccupied() ? cell.getOwner() : null;
        } finally {
            lock.readLock().unlock();
        }

        if (victim != null && !victim.equals(attack.getUserId())) {
            if (scoreboard.takePoint(victim, attack.getUserId())) {
                logger.debug("{} took a point from {}", attack.getUserId(), victim);
            }
        }
    }

    @Override
    public List<RelatedPosition> getRelatedPositions(Position position, int visibilityModifier) {
        int radius = Math.max(0, BASE_VISIBILITY + visibilityModifier);
        Position center = clamp(position);
        int minX = Math.max(0, center.getX() - radius);
        int maxX = Math.min(size - 1, center.getX() + radius);
        int minY = Math.max(0, center.getY() - radius);
        int maxY = Math.min(size - 1, center.getY() + radius);

        List<RelatedPosition> related = new ArrayList<>((maxX - minX + 1) * (maxY - minY + 1));
        lock.readLock().lock();
        try {
            for (int y = minY; y <= maxY; y++) {
                for (int x = minX; x <= maxX; x++) {
                    related.add(new RelatedPosition(cells[y][x], new Position(x, y)));
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return related;
    }

    @Override
    public void removeUser(String userId) {
        lock.writeLock().lock();
        try {
            UserStatus status = userStatuses.getUserStatus(userId);
            if (status != null) {
                vacate(status.getPosition(), userId);
            }
            userStatuses.removeUser(userId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Cell getCell(Position position) {
        lock.readLock().lock();
        try {
            return cellAt(clamp(position));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int getCoinCount() {
        lock.readLock().lock();
        try {
            return coinCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int getItemCount() {
        lock.readLock().lock();
        try {
            return itemCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getSize() {
        return size;
    }

    private void vacate(Position position, String userId) {
        Cell cell = cellAt(position);
        if (cell.isOccupied() && cell.getOwner().equals(userId)) {
            cells[position.getY()][position.getX()] = cell.vacated();
        }
    }

    private Cell cellAt(Position position) {
        return cells[position.getY()][position.getX()];
    }

    private Position clamp(Position position) {
        int x = Math.min(size - 1, Math.max(0, position.getX()));
        int y = Math.min(size - 1, Math.max(0, position.getY()));
        return x == position.getX() && y == position.getY() ? position : new Position(x, y);
    }

    private int freeGroundCells() {
        int free = 0;
        for (Cell[] row : cells) {
            for (Cell cell : row) {
                if (cell.getKind() == CellKind.GROUND && !cell.isOccupied()) {
                    free++;
                }
            }
        }
        return free;
    }
}
